/*
 * Copyright 2018 Midokura SARL
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.midonet.switchport.topology;

import java.util.EnumSet;
import java.util.Set;

import org.midonet.switchport.cluster.data.neutron.Port;
import org.midonet.switchport.cluster.data.neutron.VifType;
import org.midonet.switchport.cluster.data.neutron.VnicType;

/**
 * How a port is wired to the physical network, which decides how it is
 * located on a switch.
 */
public enum PortKind {

    /** Plugged straight into a switch port given by its link information. */
    BAREMETAL,
    /** A virtual machine port behind the uplink of its compute host. */
    COMPUTE,
    /** A virtual machine port on a passthrough (SR-IOV) function. */
    COMPUTE_PASSTHROUGH,
    /** Not handled by this driver. */
    UNMANAGED;

    private static final Set<VnicType> SUPPORTED_VNIC_TYPES =
        EnumSet.of(VnicType.NORMAL, VnicType.BAREMETAL, VnicType.DIRECT);

    public static PortKind of(Port port) {
        if (port == null) {
            return UNMANAGED;
        }
        if (port.vnicType == VnicType.BAREMETAL) {
            return BAREMETAL;
        }
        if (port.isCompute()) {
            return port.vnicType == VnicType.DIRECT ? COMPUTE_PASSTHROUGH
                                                    : COMPUTE;
        }
        return UNMANAGED;
    }

    public boolean isCompute() {
        return this == COMPUTE || this == COMPUTE_PASSTHROUGH;
    }

    public static boolean isSupported(Port port) {
        return port != null && SUPPORTED_VNIC_TYPES.contains(port.vnicType);
    }

    /**
     * Whether the port was bound by this driver: bare metal ports get the
     * "other" VIF type, compute ports are bound by Open vSwitch.
     */
    public static boolean isBound(Port port) {
        if (!isSupported(port)) {
            return false;
        }
        switch (of(port)) {
            case BAREMETAL:
                return port.vifType == VifType.OTHER;
            case COMPUTE:
            case COMPUTE_PASSTHROUGH:
                return port.vifType == VifType.OVS;
            default:
                return false;
        }
    }
}
