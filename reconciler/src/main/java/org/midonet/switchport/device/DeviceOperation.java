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

/**
 * The operations a switch can be asked to run.
 */
public enum DeviceOperation {

    CREATE_VLAN("create_vlan", false),
    DELETE_VLAN("delete_vlan", false),
    CONF_ACCESS_PORT("conf_access_port", true),
    CONF_TRUNK_PORT("conf_trunk_port", true),
    ADD_TRUNK_VLAN("add_trunk_vlan", false),
    DELETE_TRUNK_VLAN("delete_trunk_vlan", false),
    DELETE_PORT("delete_port", true);

    private final String value;
    private final boolean fullReplace;

    DeviceOperation(String value, boolean fullReplace) {
        this.value = value;
        this.fullReplace = fullReplace;
    }

    public String value() {
        return value;
    }

    /**
     * Whether the operation overwrites the whole configuration of the port,
     * as opposed to adding or removing a single VLAN from it.
     */
    public boolean isFullReplace() {
        return fullReplace;
    }

    @Override
    public String toString() {
        return value;
    }
}
