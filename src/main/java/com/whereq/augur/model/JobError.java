package com.whereq.augur.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Classified failure captured on a FAILED job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobError implements Serializable {
    private static final long serialVersionUID = 1L;

    private ErrorKind kind;

    private String message;

    public static JobError of(ErrorKind kind, String message) {
        return new JobError(kind, message);
    }
}
