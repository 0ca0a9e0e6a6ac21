package com.topology.core.service.model;

/**
 * Device attributes that carry provenance and are merged by precedence.
 */
public enum DeviceAttribute {
    IP_ADDRESS(ObservationFields.IP),
    HOSTNAME(ObservationFields.HOSTNAME),
    DEVICE_TYPE(ObservationFields.DEVICE_TYPE),
    VENDOR(ObservationFields.VENDOR),
    MODEL(ObservationFields.MODEL),
    OS_VERSION(ObservationFields.OS_VERSION),
    LOCATION(ObservationFields.LOCATION),
    DESCRIPTION(ObservationFields.DESCRIPTION);

    private final String payloadKey;

    DeviceAttribute(String payloadKey) {
        this.payloadKey = payloadKey;
    }

    /**
     * Key under which a discovery record carries this attribute.
     */
    public String payloadKey() {
        return payloadKey;
    }
}
