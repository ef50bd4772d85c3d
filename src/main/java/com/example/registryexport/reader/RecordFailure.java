package com.example.registryexport.reader;

import com.example.registryexport.codec.RecordFormatException;
import lombok.Value;

/** A record that failed to decode, with where it came from. */
@Value
public class RecordFailure {
    String source;
    int lineNumber;
    RecordFormatException.Reason reason;
    String message;

    @Override
    public String toString() {
        return source + ":" + lineNumber + " " + reason + " " + message;
    }
}
