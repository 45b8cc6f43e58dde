package com.lbg.markets.surveillance.hsm.error;

public class NamespaceNotFoundException extends HsmException {

    public NamespaceNotFoundException(String namespace) {
        super("Status namespace is not registered: " + namespace);
    }
}
