package com.example.docxschema.util.schema.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 运行结果：有序输出单元 + 诊断
 */
public final class RunResult {

    private final List<RenderedUnit> units;
    private final List<RunDiagnostic> diagnostics;

    @JsonCreator
    public RunResult(@JsonProperty("units") List<RenderedUnit> units,
                     @JsonProperty("diagnostics") List<RunDiagnostic> diagnostics) {
        this.units = units == null ? Collections.<RenderedUnit>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(units));
        this.diagnostics = diagnostics == null ? Collections.<RunDiagnostic>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    @JsonProperty("units")
    public List<RenderedUnit> getUnits() { return units; }

    @JsonProperty("diagnostics")
    public List<RunDiagnostic> getDiagnostics() { return diagnostics; }

    @JsonIgnore
    public boolean hasDiagnostic(RunDiagnostic.Type type) {
        for (RunDiagnostic d : diagnostics) {
            if (d.getType() == type) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "RunResult{units=" + units + ", diagnostics=" + diagnostics + "}";
    }
}
