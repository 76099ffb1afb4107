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
package org.midonet.switchport.inventory;

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * One switch of the inventory. Immutable once the inventory is loaded.
 */
public final class SwitchIdentity {

    private final String name;
    private final String mac;
    private final boolean manageVlans;
    private final ImmutableMap<String, String> connectionParams;
    private final ImmutableMap<String, Object> extraParams;

    public SwitchIdentity(String name, String mac, boolean manageVlans,
                          Map<String, String> connectionParams,
                          Map<String, Object> extraParams) {
        this.name = name;
        this.mac = mac == null ? null : mac.toUpperCase();
        this.manageVlans = manageVlans;
        this.connectionParams = ImmutableMap.copyOf(connectionParams);
        this.extraParams = ImmutableMap.copyOf(extraParams);
    }

    public String getName() {
        return name;
    }

    /**
     * The switch MAC address in upper case, or null if not configured.
     */
    public String getMac() {
        return mac;
    }

    /**
     * Whether VLANs are created and deleted on this switch as networks come
     * and go.
     */
    public boolean managesVlans() {
        return manageVlans;
    }

    /**
     * Parameters needed to reach the device (address, credentials, OS).
     */
    public ImmutableMap<String, String> getConnectionParams() {
        return connectionParams;
    }

    /**
     * Parameters passed along with every operation on this switch.
     */
    public ImmutableMap<String, Object> getExtraParams() {
        return extraParams;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("mac", mac)
            .add("manageVlans", manageVlans)
            .add("extraParams", extraParams)
            .toString();
    }
}
