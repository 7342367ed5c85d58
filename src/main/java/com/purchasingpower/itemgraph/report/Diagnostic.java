package com.purchasingpower.itemgraph.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Single integrity finding.
 *
 * <p>Immutable and thread-safe.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class Diagnostic {
    IngestionStage stage;
    String identifier;      // offending node identifier, or "#<position>" when the record had none
    DiagnosticKind kind;
    Severity severity;
    String detail;          // e.g., "resultType '/Lotus/Weapons/Foo' matches no Weapon or Resource"

    public static Diagnostic of(IngestionStage stage, String identifier, DiagnosticKind kind, String detail) {
        return Diagnostic.builder()
                .stage(stage)
                .identifier(identifier)
                .kind(kind)
                .severity(kind.getSeverity())
                .detail(detail)
                .build();
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }
}
