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
package org.midonet.switchport.cluster.data.neutron;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * One entry of the local_link_information list of a port binding profile:
 * where a directly attached port is cabled on the physical switch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LocalLinkInfo {

    /** MAC address of the switch. */
    @JsonProperty("switch_id")
    public String switchId;

    /** Name of the switch, if known to the operator. */
    @JsonProperty("switch_info")
    public String switchInfo;

    @JsonProperty("port_id")
    public String portId;

    public LocalLinkInfo() {}

    public LocalLinkInfo(String switchId, String switchInfo, String portId) {
        this.switchId = switchId;
        this.switchInfo = switchInfo;
        this.portId = portId;
    }

    @Override
    public final boolean equals(Object obj) {

        if (obj == this) return true;

        if (!(obj instanceof LocalLinkInfo)) return false;
        final LocalLinkInfo other = (LocalLinkInfo) obj;

        return Objects.equal(switchId, other.switchId)
                && Objects.equal(switchInfo, other.switchInfo)
                && Objects.equal(portId, other.portId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(switchId, switchInfo, portId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("switchId", switchId)
                .add("switchInfo", switchInfo)
                .add("portId", portId)
                .toString();
    }
}
