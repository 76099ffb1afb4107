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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static description of the managed switches, loaded once at start up.
 *
 * Besides the per switch settings it holds two lookup tables: switch MAC to
 * switch name, used to locate bare metal ports that only report the MAC of
 * the switch they are wired to, and compute host id to switch ports, used
 * to locate virtual machine ports.
 */
public class SwitchInventory {

    private static final Logger log =
        LoggerFactory.getLogger(SwitchInventory.class);

    public static final String MAC = "mac";
    public static final String MANAGE_VLANS = "manage_vlans";
    public static final String PORT_MAPPINGS = "port_mappings";
    public static final String CONNECTION_PREFIX = "ansible_";
    public static final String CUSTOM_PARAM_PREFIX = "cp_";
    public static final List<String> EXTRA_PARAMS =
        ImmutableList.of("stp_edge");

    private final ImmutableMap<String, SwitchIdentity> switches;
    private final ImmutableMap<String, String> macMap;
    private final ImmutableListMultimap<String, PortMapping> portMappings;

    public SwitchInventory(Collection<SwitchIdentity> switches,
                           Map<String, List<PortMapping>> portMappings) {
        ImmutableMap.Builder<String, SwitchIdentity> byName =
            ImmutableMap.builder();
        Map<String, String> macs = new HashMap<>();
        for (SwitchIdentity sw : switches) {
            byName.put(sw.getName(), sw);
            if (sw.getMac() != null) {
                macs.put(sw.getMac(), sw.getName());
            }
        }
        this.switches = byName.build();
        this.macMap = ImmutableMap.copyOf(macs);

        ImmutableListMultimap.Builder<String, PortMapping> mappings =
            ImmutableListMultimap.builder();
        for (Map.Entry<String, List<PortMapping>> e : portMappings.entrySet()) {
            mappings.putAll(e.getKey(), e.getValue());
        }
        this.portMappings = mappings.build();
    }

    /**
     * Builds the inventory from the "switchport.inventory" object, which
     * holds one object per switch keyed by the switch name.
     */
    public static SwitchInventory fromConfig(Config inventory) {
        List<SwitchIdentity> switches = new ArrayList<>();
        Map<String, List<PortMapping>> mappings = new LinkedHashMap<>();

        // Sorted, HOCON objects do not keep the order of their keys.
        for (String name : new TreeSet<>(inventory.root().keySet())) {
            Config sw = inventory.getConfig(ConfigUtil.joinPath(name));
            String mac = sw.hasPath(MAC) ? sw.getString(MAC) : null;
            boolean manageVlans = !sw.hasPath(MANAGE_VLANS)
                                  || sw.getBoolean(MANAGE_VLANS);

            Map<String, String> connection = new LinkedHashMap<>();
            Map<String, Object> extra = new LinkedHashMap<>();
            for (Map.Entry<String, ConfigValue> e : sw.root().entrySet()) {
                String key = e.getKey();
                Object value = e.getValue().unwrapped();
                if (key.startsWith(CONNECTION_PREFIX)) {
                    connection.put(key, String.valueOf(value));
                } else if (key.startsWith(CUSTOM_PARAM_PREFIX)) {
                    extra.put(key.substring(CUSTOM_PARAM_PREFIX.length()),
                              value);
                } else if (EXTRA_PARAMS.contains(key)) {
                    extra.put(key, value);
                }
            }

            for (String entry : mappingEntries(sw)) {
                String[] parsed = PortMapping.parseEntry(entry);
                mappings.computeIfAbsent(parsed[0], k -> new ArrayList<>())
                        .add(new PortMapping(name, parsed[1]));
            }

            SwitchIdentity identity =
                new SwitchIdentity(name, mac, manageVlans, connection, extra);
            log.debug("Loaded switch {}", identity);
            switches.add(identity);
        }

        log.info("Loaded {} switches and port mappings for {} hosts",
                 switches.size(), mappings.size());
        return new SwitchInventory(switches, mappings);
    }

    private static List<String> mappingEntries(Config sw) {
        if (!sw.hasPath(PORT_MAPPINGS)) {
            return Collections.emptyList();
        }
        if (sw.getValue(PORT_MAPPINGS).valueType() == ConfigValueType.LIST) {
            return sw.getStringList(PORT_MAPPINGS);
        }
        return Splitter.on(',').trimResults().omitEmptyStrings()
                       .splitToList(sw.getString(PORT_MAPPINGS));
    }

    public SwitchIdentity getSwitch(String name) {
        return name == null ? null : switches.get(name);
    }

    public boolean hasSwitch(String name) {
        return name != null && switches.containsKey(name);
    }

    public Collection<SwitchIdentity> switches() {
        return switches.values();
    }

    /**
     * The switches on which VLANs follow the network life cycle, sorted by
     * name.
     */
    public List<SwitchIdentity> vlanManagedSwitches() {
        List<SwitchIdentity> managed = new ArrayList<>();
        for (SwitchIdentity sw : switches.values()) {
            if (sw.managesVlans()) {
                managed.add(sw);
            }
        }
        return managed;
    }

    /**
     * @return The name of the switch with the given MAC, compared case
     *         insensitively, or null if none.
     */
    public String switchForMac(String mac) {
        return mac == null ? null : macMap.get(mac.toUpperCase());
    }

    /**
     * @return The switch ports wired to the given host id, possibly none.
     */
    public List<PortMapping> portMappings(String hostId) {
        if (hostId == null) {
            return ImmutableList.of();
        }
        return portMappings.get(hostId);
    }
}
