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

import org.midonet.switchport.inventory.SwitchIdentity;
import org.midonet.switchport.inventory.SwitchInventory;

/**
 * Turns each gateway call into a {@link DeviceRequest} carrying the
 * connection and extra parameters of the target switch, and hands it to
 * {@link #execute}.
 * Requests for switches missing from the inventory are rejected.
 */
public abstract class AbstractDeviceGateway implements DeviceGateway {

    protected final SwitchInventory inventory;

    protected AbstractDeviceGateway(SwitchInventory inventory) {
        this.inventory = inventory;
    }

    /**
     * Runs the request on the device. Only called for inventory switches.
     */
    protected abstract void execute(DeviceRequest request)
        throws DeviceOperationException;

    @Override
    public boolean hasHost(String switchName) {
        return inventory.hasSwitch(switchName);
    }

    @Override
    public void createVlan(String switchName, int vlan)
            throws DeviceOperationException {
        submit(DeviceOperation.CREATE_VLAN, switchName, null, vlan, null);
    }

    @Override
    public void deleteVlan(String switchName, int vlan)
            throws DeviceOperationException {
        submit(DeviceOperation.DELETE_VLAN, switchName, null, vlan, null);
    }

    @Override
    public void confAccessPort(String switchName, String switchPort, int vlan)
            throws DeviceOperationException {
        submit(DeviceOperation.CONF_ACCESS_PORT, switchName, switchPort, vlan,
               null);
    }

    @Override
    public void confTrunkPort(String switchName, String switchPort,
                              int nativeVlan, List<Integer> trunkedVlans)
            throws DeviceOperationException {
        submit(DeviceOperation.CONF_TRUNK_PORT, switchName, switchPort,
               nativeVlan, trunkedVlans);
    }

    @Override
    public void addTrunkVlan(String switchName, String switchPort, int vlan)
            throws DeviceOperationException {
        submit(DeviceOperation.ADD_TRUNK_VLAN, switchName, switchPort, vlan,
               null);
    }

    @Override
    public void deleteTrunkVlan(String switchName, String switchPort,
                                int vlan) throws DeviceOperationException {
        submit(DeviceOperation.DELETE_TRUNK_VLAN, switchName, switchPort, vlan,
               null);
    }

    @Override
    public void deletePort(String switchName, String switchPort)
            throws DeviceOperationException {
        submit(DeviceOperation.DELETE_PORT, switchName, switchPort, null,
               null);
    }

    private void submit(DeviceOperation op, String switchName,
                        String switchPort, Integer vlan,
                        List<Integer> trunkedVlans)
            throws DeviceOperationException {
        SwitchIdentity sw = inventory.getSwitch(switchName);
        if (sw == null) {
            throw new DeviceOperationException(null, "Cannot run " + op
                + ": switch " + switchName + " is not in the inventory");
        }
        execute(new DeviceRequest(op, switchName, switchPort, vlan,
                                  trunkedVlans, sw.getExtraParams(),
                                  sw.getConnectionParams()));
    }
}
