package com.vidnyan.tfguard.application.port.out;

/**
 * Port for the per-policy on/off switch.
 */
public interface PolicyActivation {

    boolean isEnabled(String policyCode);

    void setEnabled(String policyCode, boolean enabled);
}
