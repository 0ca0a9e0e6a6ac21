package com.topology.core.service.model;

/**
 * Payload keys shared by probes and the identity resolver.
 *
 * Device records use the plain keys. Link records describe each endpoint
 * with the same keys prefixed by {@link #ENDPOINT_A} or {@link #ENDPOINT_B}.
 */
public final class ObservationFields {

    public static final String MAC = "mac";
    public static final String IP = "ip";
    public static final String STABLE_ID = "stableId";
    public static final String HOSTNAME = "hostname";
    public static final String DEVICE_TYPE = "deviceType";
    public static final String VENDOR = "vendor";
    public static final String MODEL = "model";
    public static final String OS_VERSION = "osVersion";
    public static final String LOCATION = "location";
    public static final String DESCRIPTION = "description";
    public static final String STATUS = "status";

    public static final String LINK_TYPE = "linkType";
    public static final String ENDPOINT_A = "a.";
    public static final String ENDPOINT_B = "b.";
    public static final String PORT = "port";

    private ObservationFields() {
    }

    public static String endpointA(String field) {
        return ENDPOINT_A + field;
    }

    public static String endpointB(String field) {
        return ENDPOINT_B + field;
    }
}
