package com.rcatrail.exception;

import com.rcatrail.model.SourceKind;
import lombok.Getter;

/**
 * A source row that cannot become an event: no scenario id, or no resolvable timestamp.
 */
@Getter
public class MalformedRecordException extends RcaException {

    private final SourceKind source;
    private final String recordRef;

    public MalformedRecordException(SourceKind source, String recordRef, String reason) {
        super(reason);
        this.source = source;
        this.recordRef = recordRef;
    }

    public MalformedRecordException(SourceKind source, String recordRef, String reason, Throwable cause) {
        super(reason, cause);
        this.source = source;
        this.recordRef = recordRef;
    }
}
