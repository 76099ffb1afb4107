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

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import org.midonet.switchport.inventory.PortMapping;

/**
 * Where a port lives on the physical network, and the VLAN it is on.
 */
public final class SwitchMeta {

    public static final SwitchMeta EMPTY =
        new SwitchMeta(ImmutableList.<PortMapping>of(), null);

    public final ImmutableList<PortMapping> mappings;
    /** The provider segmentation id of the network, if one was given. */
    public final Integer segmentationId;

    public SwitchMeta(List<PortMapping> mappings, Integer segmentationId) {
        this.mappings = ImmutableList.copyOf(mappings);
        this.segmentationId = segmentationId;
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    public boolean contains(String switchName, String switchPort) {
        return mappings.contains(new PortMapping(switchName, switchPort));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof SwitchMeta)) return false;
        SwitchMeta other = (SwitchMeta) obj;
        return Objects.equal(mappings, other.mappings)
               && Objects.equal(segmentationId, other.segmentationId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(mappings, segmentationId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("mappings", mappings)
            .add("segmentationId", segmentationId)
            .toString();
    }
}
