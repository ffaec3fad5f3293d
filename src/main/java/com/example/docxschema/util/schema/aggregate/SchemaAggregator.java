package com.example.docxschema.util.schema.aggregate;

import com.example.docxschema.util.schema.domain.Cardinality;
import com.example.docxschema.util.schema.domain.DomainPack;
import com.example.docxschema.util.schema.domain.RoleSpec;
import com.example.docxschema.util.schema.feature.StructuralUnit;
import com.example.docxschema.util.schema.match.SlotMatch;
import com.example.docxschema.util.schema.score.DomainScore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Schema 聚合器：把逐单元的匹配结果合并为有序槽位
 *
 * - 同一 REPEATABLE 角色的连续匹配合并为一个槽位（realized_count = 合并的单元数）
 * - 槽位样式原样拷贝自第一个匹配单元
 * - 校验顺序/基数不变量，违反时抛 SchemaIntegrityException
 *
 * 纯函数：相同输入产出相等的 Schema。
 */
@Slf4j
public class SchemaAggregator {

    public Schema aggregate(List<SlotMatch> matches, List<StructuralUnit> units, DomainPack pack, DomainScore score) {
        validate(matches, units, pack);

        List<SchemaSlot> slots = new ArrayList<>();
        int i = 0;
        while (i < matches.size()) {
            SlotMatch first = matches.get(i);
            RoleSpec role = pack.getRole(first.getRole());
            List<Integer> indices = new ArrayList<>();
            double confSum = 0.0;
            int j = i;
            do {
                indices.add(matches.get(j).getUnitIndex());
                confSum += matches.get(j).getConfidence();
                j++;
            } while (role.getCardinality() == Cardinality.REPEATABLE
                    && j < matches.size()
                    && matches.get(j).getRole().equals(first.getRole()));

            int ordinal = slots.size();
            slots.add(new SchemaSlot(
                    String.format("slot-%03d", ordinal + 1),
                    role.getName(),
                    role.getKind() != null ? role.getKind().name() : "CUSTOM",
                    role.getCardinality(),
                    indices.size(),
                    units.get(first.getUnitIndex()).getStyle(),
                    ordinal,
                    indices,
                    SchemaSlot.placeholderFor(role.getName()),
                    confSum / indices.size(),
                    first.getFields()));
            i = j;
        }

        List<BuildDiagnostic> diagnostics = new ArrayList<>();
        Set<String> realized = new HashSet<>();
        for (SlotMatch m : matches) {
            realized.add(m.getRole());
        }
        for (RoleSpec r : pack.getRequiredRoles()) {
            if (!realized.contains(r.getName())) {
                diagnostics.add(new BuildDiagnostic(BuildDiagnostic.Type.MISSING_REQUIRED_ROLE, r.getName(),
                        "No unit reached the confidence threshold for required role " + r.getName()));
            }
        }

        Schema schema = new Schema(pack.getName(), score != null ? score.getScore() : 0.0, slots, diagnostics);
        log.info("Aggregated schema for domain {}: {} slots from {} matches, {} diagnostics",
                pack.getName(), slots.size(), matches.size(), diagnostics.size());
        return schema;
    }

    private void validate(List<SlotMatch> matches, List<StructuralUnit> units, DomainPack pack) {
        int lastUnit = -1;
        int lastRequiredPosition = -1;
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (SlotMatch m : matches) {
            if (m.getUnitIndex() <= lastUnit) {
                throw new SchemaIntegrityException("Non-monotonic unit indices: " + m.getUnitIndex()
                        + " after " + lastUnit);
            }
            if (m.getUnitIndex() >= units.size()) {
                throw new SchemaIntegrityException("Match refers to unit " + m.getUnitIndex()
                        + " but only " + units.size() + " units exist");
            }
            lastUnit = m.getUnitIndex();

            RoleSpec role = pack.getRole(m.getRole());
            if (role == null) {
                throw new SchemaIntegrityException("Role " + m.getRole() + " is unknown to domain " + pack.getName());
            }
            int count = counts.merge(role.getName(), 1, Integer::sum);
            if (count > 1 && role.getCardinality() != Cardinality.REPEATABLE) {
                throw new SchemaIntegrityException("Role " + role.getName() + " with cardinality "
                        + role.getCardinality() + " realized " + count + " times");
            }
            if (role.isRequired()) {
                int position = pack.indexOf(role.getName());
                if (position < lastRequiredPosition) {
                    throw new SchemaIntegrityException("Required role " + role.getName()
                            + " appears out of the declared order of domain " + pack.getName());
                }
                lastRequiredPosition = position;
            }
        }
    }
}
