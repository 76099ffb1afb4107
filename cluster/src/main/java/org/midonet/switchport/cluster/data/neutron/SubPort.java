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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A child port of a trunk, pinned to one member VLAN of the trunk.
 */
public class SubPort {

    @JsonProperty("port_id")
    public UUID portId;

    @JsonProperty("segmentation_type")
    public String segmentationType = NetworkSegment.TYPE_VLAN;

    @JsonProperty("segmentation_id")
    public int segmentationId;

    public SubPort() {}

    public SubPort(UUID portId, int segmentationId) {
        this.portId = portId;
        this.segmentationId = segmentationId;
    }

    @Override
    public final boolean equals(Object obj) {

        if (obj == this) return true;

        if (!(obj instanceof SubPort)) return false;
        final SubPort other = (SubPort) obj;

        return Objects.equal(portId, other.portId)
                && Objects.equal(segmentationType, other.segmentationType)
                && segmentationId == other.segmentationId;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(portId, segmentationType, segmentationId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("portId", portId)
                .add("segmentationType", segmentationType)
                .add("segmentationId", segmentationId)
                .toString();
    }
}
