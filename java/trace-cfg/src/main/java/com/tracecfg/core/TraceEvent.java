package com.tracecfg.core;

import com.tracecfg.core.domain.TraceRecord;

public class TraceEvent {
    private final long address;
    private final TraceRecord record;
    private final int lineNumber;

    public TraceEvent(long address, TraceRecord record, int lineNumber) {
        this.address = address;
        this.record = record;
        this.lineNumber = lineNumber;
    }

    public long getAddress() {
        return address;
    }

    public TraceRecord getRecord() {
        return record;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
