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

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

public class NetworkSegment {

    public static final String TYPE_VLAN = "vlan";
    public static final String TYPE_FLAT = "flat";
    public static final String TYPE_VXLAN = "vxlan";

    public UUID id;

    @JsonProperty("network_id")
    public UUID networkId;

    @JsonProperty("network_type")
    public String networkType;

    @JsonProperty("segmentation_id")
    public Integer segmentationId;

    @JsonProperty("physical_network")
    public String physicalNetwork;

    public NetworkSegment() {}

    public NetworkSegment(UUID id, UUID networkId, String networkType,
                          Integer segmentationId, String physicalNetwork) {
        this.id = id;
        this.networkId = networkId;
        this.networkType = networkType;
        this.segmentationId = segmentationId;
        this.physicalNetwork = physicalNetwork;
    }

    public static NetworkSegment vlan(UUID networkId, int segmentationId,
                                      String physicalNetwork) {
        return new NetworkSegment(UUID.randomUUID(), networkId, TYPE_VLAN,
                                  segmentationId, physicalNetwork);
    }

    @JsonIgnore
    public final boolean isVlan() {
        return TYPE_VLAN.equals(networkType);
    }

    /**
     * Whether this segment carries the given VLAN on the given physical
     * network.
     */
    @JsonIgnore
    public final boolean isVlan(int vlan, String physnet) {
        return isVlan() && segmentationId != null
               && segmentationId == vlan
               && Objects.equal(physicalNetwork, physnet);
    }

    @Override
    public final boolean equals(Object obj) {

        if (obj == this) return true;

        if (!(obj instanceof NetworkSegment)) return false;
        final NetworkSegment other = (NetworkSegment) obj;

        return Objects.equal(id, other.id)
                && Objects.equal(networkId, other.networkId)
                && Objects.equal(networkType, other.networkType)
                && Objects.equal(segmentationId, other.segmentationId)
                && Objects.equal(physicalNetwork, other.physicalNetwork);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, networkId, networkType, segmentationId,
                                physicalNetwork);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("networkId", networkId)
                .add("networkType", networkType)
                .add("segmentationId", segmentationId)
                .add("physicalNetwork", physicalNetwork)
                .toString();
    }
}
