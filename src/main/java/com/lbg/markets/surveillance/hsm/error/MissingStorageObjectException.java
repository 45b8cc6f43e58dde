package com.lbg.markets.surveillance.hsm.error;

public class MissingStorageObjectException extends HsmException {

    public MissingStorageObjectException(long datafileId) {
        super("Datafile has no preferred storage object: " + datafileId);
    }
}
