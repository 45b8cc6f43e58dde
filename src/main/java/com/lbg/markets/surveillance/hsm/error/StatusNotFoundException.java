package com.lbg.markets.surveillance.hsm.error;

public class StatusNotFoundException extends HsmException {

    public StatusNotFoundException(String namespace, long datafileId) {
        super(String.format("No online status recorded for datafile %d in %s", datafileId, namespace));
    }
}
