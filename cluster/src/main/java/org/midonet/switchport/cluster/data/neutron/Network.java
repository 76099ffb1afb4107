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

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

public class Network {

    public UUID id;

    public String name;

    @JsonProperty("tenant_id")
    public String tenantId;

    @JsonProperty("admin_state_up")
    public boolean adminStateUp = true;

    public List<NetworkSegment> segments = new ArrayList<>();

    public Network() {}

    public Network(UUID id, String name) {
        this.id = id;
        this.name = name;
    }

    /**
     * Returns a copy of this network whose segment list can be changed
     * without affecting this instance.
     */
    public Network copy() {
        Network net = new Network(id, name);
        net.tenantId = tenantId;
        net.adminStateUp = adminStateUp;
        for (NetworkSegment seg : segments) {
            net.segments.add(new NetworkSegment(seg.id, seg.networkId,
                                                seg.networkType,
                                                seg.segmentationId,
                                                seg.physicalNetwork));
        }
        return net;
    }

    /**
     * The provider segment, i.e. the first one. The network type,
     * segmentation id and physical network of a network event are those of
     * this segment.
     */
    @JsonIgnore
    public final NetworkSegment firstSegment() {
        return segments == null || segments.isEmpty() ? null : segments.get(0);
    }

    /**
     * The first VLAN segment of the network, or null if it has none.
     */
    @JsonIgnore
    public final NetworkSegment primarySegment() {
        if (segments == null) return null;
        for (NetworkSegment seg : segments) {
            if (seg.isVlan()) return seg;
        }
        return null;
    }

    @JsonIgnore
    public final String networkType() {
        NetworkSegment seg = firstSegment();
        return seg == null ? null : seg.networkType;
    }

    @JsonIgnore
    public final Integer segmentationId() {
        NetworkSegment seg = firstSegment();
        return seg == null ? null : seg.segmentationId;
    }

    @JsonIgnore
    public final String physicalNetwork() {
        NetworkSegment seg = firstSegment();
        return seg == null ? null : seg.physicalNetwork;
    }

    @JsonIgnore
    public final boolean isVlan() {
        return NetworkSegment.TYPE_VLAN.equals(networkType());
    }

    @JsonIgnore
    public final boolean hasSegmentationId(int segmentationId) {
        if (segments == null) return false;
        for (NetworkSegment seg : segments) {
            if (seg.segmentationId != null
                && seg.segmentationId == segmentationId) {
                return true;
            }
        }
        return false;
    }

    @Override
    public final boolean equals(Object obj) {

        if (obj == this) return true;

        if (!(obj instanceof Network)) return false;
        final Network other = (Network) obj;

        return Objects.equal(id, other.id)
                && Objects.equal(name, other.name)
                && Objects.equal(tenantId, other.tenantId)
                && adminStateUp == other.adminStateUp
                && Objects.equal(segments, other.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, name, tenantId, adminStateUp, segments);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("name", name)
                .add("tenantId", tenantId)
                .add("adminStateUp", adminStateUp)
                .add("segments", segments)
                .toString();
    }
}
