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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The binding:vnic_type of a port, which tells how the port is plugged.
 */
public enum VnicType {

    NORMAL("normal"),
    BAREMETAL("baremetal"),
    DIRECT("direct"),
    DIRECT_PHYSICAL("direct-physical"),
    MACVTAP("macvtap");

    private final String value;

    VnicType(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static VnicType forValue(String v) {
        if (v == null) return null;

        for (VnicType vnicType : VnicType.values()) {
            if (v.equalsIgnoreCase(vnicType.value)) {
                return vnicType;
            }
        }

        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
