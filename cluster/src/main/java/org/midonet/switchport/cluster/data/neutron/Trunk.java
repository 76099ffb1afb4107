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
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

public class Trunk {

    public UUID id;

    public String name;

    /** The parent port, which carries the native VLAN. */
    @JsonProperty("port_id")
    public UUID portId;

    @JsonProperty("sub_ports")
    public List<SubPort> subPorts = new ArrayList<>();

    public Trunk() {}

    public Trunk(UUID id, UUID portId) {
        this.id = id;
        this.portId = portId;
    }

    public Trunk copy() {
        Trunk trunk = new Trunk(id, portId);
        trunk.name = name;
        for (SubPort sp : subPorts) {
            SubPort copy = new SubPort(sp.portId, sp.segmentationId);
            copy.segmentationType = sp.segmentationType;
            trunk.subPorts.add(copy);
        }
        return trunk;
    }

    /**
     * The VLANs of every sub-port, ascending and without duplicates.
     */
    @JsonIgnore
    public final SortedSet<Integer> trunkedVlans() {
        SortedSet<Integer> vlans = new TreeSet<>();
        if (subPorts != null) {
            for (SubPort sp : subPorts) {
                vlans.add(sp.segmentationId);
            }
        }
        return vlans;
    }

    @Override
    public final boolean equals(Object obj) {

        if (obj == this) return true;

        if (!(obj instanceof Trunk)) return false;
        final Trunk other = (Trunk) obj;

        return Objects.equal(id, other.id)
                && Objects.equal(name, other.name)
                && Objects.equal(portId, other.portId)
                && Objects.equal(subPorts, other.subPorts);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, name, portId, subPorts);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("name", name)
                .add("portId", portId)
                .add("subPorts", subPorts)
                .toString();
    }
}
