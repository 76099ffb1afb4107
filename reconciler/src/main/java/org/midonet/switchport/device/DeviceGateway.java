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
package org.midonet.switchport.device;

import java.util.List;

/**
 * Runs configuration operations on physical switches. All operations are
 * idempotent on the device side. A failure is reported by throwing
 * {@link DeviceOperationException}; retrying is the caller's business.
 */
public interface DeviceGateway {

    /**
     * @return Whether the switch is known to this gateway.
     */
    boolean hasHost(String switchName);

    void createVlan(String switchName, int vlan)
        throws DeviceOperationException;

    void deleteVlan(String switchName, int vlan)
        throws DeviceOperationException;

    /**
     * Makes the port an access port of the given VLAN, replacing whatever
     * configuration it had.
     */
    void confAccessPort(String switchName, String switchPort, int vlan)
        throws DeviceOperationException;

    /**
     * Makes the port a trunk port carrying exactly the given VLANs,
     * replacing whatever configuration it had.
     */
    void confTrunkPort(String switchName, String switchPort, int nativeVlan,
                       List<Integer> trunkedVlans)
        throws DeviceOperationException;

    /**
     * Adds one VLAN to a trunk port, leaving the others in place.
     */
    void addTrunkVlan(String switchName, String switchPort, int vlan)
        throws DeviceOperationException;

    void deleteTrunkVlan(String switchName, String switchPort, int vlan)
        throws DeviceOperationException;

    /**
     * Removes all the configuration of a switch port.
     */
    void deletePort(String switchName, String switchPort)
        throws DeviceOperationException;
}
