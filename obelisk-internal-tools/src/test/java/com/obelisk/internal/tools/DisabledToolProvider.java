package com.obelisk.internal.tools;

public class DisabledToolProvider extends GreetingToolProvider {

    @Override
    public boolean isEnabled() {
        return false;
    }
}
