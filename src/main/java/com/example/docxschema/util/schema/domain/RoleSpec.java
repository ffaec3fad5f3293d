package com.example.docxschema.util.schema.domain;

import com.example.docxschema.util.schema.detect.DetectorKind;

import java.util.Objects;

/**
 * 域内角色声明：角色名、检测器种类、基数、打分权重
 *
 * 角色名只在所属 DomainPack 内有意义，两个域里的同名角色互不相干。
 */
public final class RoleSpec {

    private final String name;
    private final DetectorKind kind;
    private final Cardinality cardinality;
    private final double weight;

    public RoleSpec(String name, DetectorKind kind, Cardinality cardinality, double weight) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Role name must not be blank");
        }
        if (cardinality == null) {
            throw new IllegalArgumentException("Role " + name + " has no cardinality");
        }
        if (!(weight > 0)) {
            throw new IllegalArgumentException("Role " + name + " must have a positive weight, got " + weight);
        }
        this.name = name;
        this.kind = kind;
        this.cardinality = cardinality;
        this.weight = weight;
    }

    public String getName() { return name; }

    /** 检测器种类；显式注入检测器的角色可能为 null */
    public DetectorKind getKind() { return kind; }

    public Cardinality getCardinality() { return cardinality; }
    public double getWeight() { return weight; }

    public boolean isRequired() {
        return cardinality.isRequired();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoleSpec)) return false;
        RoleSpec that = (RoleSpec) o;
        return Double.compare(that.weight, weight) == 0
                && name.equals(that.name)
                && kind == that.kind
                && cardinality == that.cardinality;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, cardinality, weight);
    }

    @Override
    public String toString() {
        return name + "(" + (kind != null ? kind : "custom") + ", " + cardinality + ", w=" + weight + ")";
    }
}
