package com.nexuscontrol.dispatch;

public class AdapterNotFoundException extends RuntimeException {

    public AdapterNotFoundException(String adapterRef) {
        super("No adapter registered with id or kind '" + adapterRef + "'");
    }
}
