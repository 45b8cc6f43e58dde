package com.lbg.markets.surveillance.hsm.error;

public class MultipleHsmConfigException extends HsmException {

    public MultipleHsmConfigException(String storageBoxId, int count) {
        super(String.format("Storage box %s has %d HSM configs, expected at most one",
                storageBoxId, count));
    }
}
