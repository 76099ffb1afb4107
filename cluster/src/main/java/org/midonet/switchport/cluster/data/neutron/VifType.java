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
 * The binding:vif_type of a port, set by whichever driver bound it.
 */
public enum VifType {

    UNBOUND("unbound"),
    BINDING_FAILED("binding_failed"),
    OTHER("other"),
    OVS("ovs"),
    HW_VEB("hw_veb");

    private final String value;

    VifType(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static VifType forValue(String v) {
        if (v == null) return null;

        for (VifType vifType : VifType.values()) {
            if (v.equalsIgnoreCase(vifType.value)) {
                return vifType;
            }
        }

        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
