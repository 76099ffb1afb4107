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
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A single operation to run on a switch, with the parameters needed to
 * reach the switch and its extra parameters attached.
 */
public final class DeviceRequest {

    public final DeviceOperation operation;
    public final String switchName;
    /** Null for VLAN operations. */
    public final String switchPort;
    /** The VLAN, or the native VLAN of a trunk. Null for port deletion. */
    public final Integer vlan;
    public final ImmutableList<Integer> trunkedVlans;
    public final ImmutableMap<String, Object> extraParams;
    /** May hold credentials, so it is left out of {@link #toString()}. */
    public final ImmutableMap<String, String> connectionParams;

    public DeviceRequest(DeviceOperation operation, String switchName,
                         String switchPort, Integer vlan,
                         List<Integer> trunkedVlans,
                         Map<String, Object> extraParams,
                         Map<String, String> connectionParams) {
        this.operation = operation;
        this.switchName = switchName;
        this.switchPort = switchPort;
        this.vlan = vlan;
        this.trunkedVlans = trunkedVlans == null
                            ? ImmutableList.<Integer>of()
                            : ImmutableList.copyOf(trunkedVlans);
        this.extraParams = extraParams == null
                           ? ImmutableMap.<String, Object>of()
                           : ImmutableMap.copyOf(extraParams);
        this.connectionParams = connectionParams == null
                                ? ImmutableMap.<String, String>of()
                                : ImmutableMap.copyOf(connectionParams);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof DeviceRequest)) return false;
        DeviceRequest other = (DeviceRequest) obj;
        return operation == other.operation
               && Objects.equal(switchName, other.switchName)
               && Objects.equal(switchPort, other.switchPort)
               && Objects.equal(vlan, other.vlan)
               && Objects.equal(trunkedVlans, other.trunkedVlans)
               && Objects.equal(extraParams, other.extraParams)
               && Objects.equal(connectionParams, other.connectionParams);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(operation, switchName, switchPort, vlan,
                                trunkedVlans, extraParams, connectionParams);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("operation", operation)
            .add("switchName", switchName)
            .add("switchPort", switchPort)
            .add("vlan", vlan)
            .add("trunkedVlans", trunkedVlans)
            .add("extraParams", extraParams)
            .toString();
    }
}
