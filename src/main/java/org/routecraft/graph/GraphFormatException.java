package org.routecraft.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.io.IOException;
import java.util.Objects;

/**
 * Map file content that {@link GraphCodec} refuses to decode.
 *
 * <p>The message reads {@code [REASON_CODE] detail}; the code is one of the
 * {@code GraphCodec.REASON_*} constants.</p>
 */
@Getter
@Accessors(fluent = true)
public final class GraphFormatException extends IOException {
    private final String reasonCode;

    public GraphFormatException(String reasonCode, String detail) {
        super("[" + checkedCode(reasonCode) + "] " + Objects.requireNonNull(detail, "detail"));
        this.reasonCode = reasonCode;
    }

    private static String checkedCode(String reasonCode) {
        if (Objects.requireNonNull(reasonCode, "reasonCode").isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
