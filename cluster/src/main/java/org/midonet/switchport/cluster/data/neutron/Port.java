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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

public class Port {

    public static final String LOCAL_LINK_INFORMATION = "local_link_information";
    public static final String PCI_SLOT = "pci_slot";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<List<LocalLinkInfo>> LLI_LIST =
        new TypeReference<List<LocalLinkInfo>>() {};

    public UUID id;

    public String name;

    @JsonProperty("network_id")
    public UUID networkId;

    @JsonProperty("admin_state_up")
    public boolean adminStateUp = true;

    @JsonProperty("mac_address")
    public String macAddress;

    @JsonProperty("device_id")
    public String deviceId;

    @JsonProperty("device_owner")
    public DeviceOwner deviceOwner;

    @JsonProperty("tenant_id")
    public String tenantId;

    public String status;

    @JsonProperty("binding:host_id")
    public String hostId;

    @JsonProperty("binding:vnic_type")
    public VnicType vnicType = VnicType.NORMAL;

    @JsonProperty("binding:vif_type")
    public VifType vifType = VifType.UNBOUND;

    @JsonProperty("binding:profile")
    public Map<String, Object> profile = new HashMap<>();

    public Port() {}

    public Port(UUID id, UUID networkId, String macAddress) {
        this.id = id;
        this.networkId = networkId;
        this.macAddress = macAddress;
    }

    public Port copy() {
        Port port = new Port(id, networkId, macAddress);
        port.name = name;
        port.adminStateUp = adminStateUp;
        port.deviceId = deviceId;
        port.deviceOwner = deviceOwner;
        port.tenantId = tenantId;
        port.status = status;
        port.hostId = hostId;
        port.vnicType = vnicType;
        port.vifType = vifType;
        port.profile = profile == null ? null : new HashMap<>(profile);
        return port;
    }

    /**
     * Decodes the local link information of the binding profile.
     *
     * @return The entries, or an empty list when the profile carries none.
     * @throws IllegalArgumentException if the profile entry is malformed.
     */
    @JsonIgnore
    public final List<LocalLinkInfo> localLinkInformation() {
        if (profile == null) return Collections.emptyList();
        Object raw = profile.get(LOCAL_LINK_INFORMATION);
        if (raw == null) return Collections.emptyList();
        List<LocalLinkInfo> lli = MAPPER.convertValue(raw, LLI_LIST);
        return lli == null ? Collections.<LocalLinkInfo>emptyList() : lli;
    }

    @JsonIgnore
    public final LocalLinkInfo firstLocalLinkInfo() {
        List<LocalLinkInfo> lli = localLinkInformation();
        return lli.isEmpty() ? null : lli.get(0);
    }

    @JsonIgnore
    public final boolean hasLocalLinkInfo() {
        return firstLocalLinkInfo() != null;
    }

    @JsonIgnore
    public final String pciSlot() {
        if (profile == null) return null;
        Object slot = profile.get(PCI_SLOT);
        return slot == null ? null : slot.toString();
    }

    @JsonIgnore
    public final boolean isCompute() {
        return deviceOwner == DeviceOwner.COMPUTE;
    }

    @JsonIgnore
    public final boolean hasHost() {
        return !Strings.isNullOrEmpty(hostId);
    }

    @Override
    public final boolean equals(Object obj) {

        if (obj == this) return true;

        if (!(obj instanceof Port)) return false;
        final Port other = (Port) obj;

        return Objects.equal(id, other.id)
                && Objects.equal(name, other.name)
                && Objects.equal(networkId, other.networkId)
                && Objects.equal(adminStateUp, other.adminStateUp)
                && Objects.equal(macAddress, other.macAddress)
                && Objects.equal(deviceId, other.deviceId)
                && Objects.equal(deviceOwner, other.deviceOwner)
                && Objects.equal(tenantId, other.tenantId)
                && Objects.equal(status, other.status)
                && Objects.equal(hostId, other.hostId)
                && Objects.equal(vnicType, other.vnicType)
                && Objects.equal(vifType, other.vifType)
                && Objects.equal(profile, other.profile);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, name, networkId, adminStateUp, macAddress,
                deviceId, deviceOwner, tenantId, status, hostId, vnicType,
                vifType, profile);
    }

    @Override
    public String toString() {

        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("name", name)
                .add("networkId", networkId)
                .add("adminStateUp", adminStateUp)
                .add("macAddress", macAddress)
                .add("deviceId", deviceId)
                .add("deviceOwner", deviceOwner)
                .add("tenantId", tenantId)
                .add("status", status)
                .add("hostId", hostId)
                .add("vnicType", vnicType)
                .add("vifType", vifType)
                .add("profile", profile)
                .toString();
    }
}
