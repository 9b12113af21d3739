package com.tsa.core;

import com.tsa.exception.ErrorKind;
import com.tsa.exception.TsaException;

import java.time.LocalDateTime;

/**
 * A non-fatal error recorded during an analysis run.
 *
 * @param kind      error category
 * @param context   where the error happened, e.g. {@code COLLECTION <ylojarvi> / ylojarvi_etelaan_1_c4}
 * @param sourceRow input row, -1 if not bound to a row
 * @param position  character offset in the normalized condition, -1 if none
 * @param message   error message
 * @param timestamp when the error was recorded
 */
public record AnalysisError(ErrorKind kind,
                            String context,
                            int sourceRow,
                            int position,
                            String message,
                            LocalDateTime timestamp) {

    public static AnalysisError of(ErrorKind kind, String context, int sourceRow, String message) {
        return new AnalysisError(kind, context, sourceRow, -1, message, LocalDateTime.now());
    }

    public static AnalysisError of(TsaException e, String context, int sourceRow) {
        return new AnalysisError(e.getKind(), context, sourceRow, e.getPosition(), e.getMessage(), LocalDateTime.now());
    }

    /**
     * Whether the other error would be reported with the same text.
     */
    public boolean isSimilarTo(AnalysisError other) {
        return kind == other.kind && context.equals(other.context) && message.equals(other.message);
    }

    /**
     * Message with context and row but no timestamp.
     */
    public String withContext() {
        StringBuilder sb = new StringBuilder(context);
        if (sourceRow >= 0) {
            sb.append(" (row ").append(sourceRow).append(')');
        }
        return sb.append(": ").append(message).toString();
    }

    @Override
    public String toString() {
        return timestamp + "; " + withContext();
    }
}
