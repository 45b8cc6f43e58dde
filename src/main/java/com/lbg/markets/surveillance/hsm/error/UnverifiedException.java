package com.lbg.markets.surveillance.hsm.error;

public class UnverifiedException extends HsmException {

    public UnverifiedException(String message) {
        super(message);
    }

    public static UnverifiedException datafile(long datafileId) {
        return new UnverifiedException(
                "Cannot check online status of unverified datafile: " + datafileId);
    }
}
