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
package org.midonet.switchport.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.midonet.switchport.cluster.config.ZookeeperConfig;

/**
 * Typed view of the "switchport" configuration tree. Values missing from the
 * given document fall back to the reference.conf shipped in this module.
 */
public class SwitchPortConfig {

    public static final String PREFIX = "switchport";

    private final Config conf;

    public SwitchPortConfig(Config root) {
        this.conf = root.withFallback(ConfigFactory.defaultReference())
                        .resolve()
                        .getConfig(PREFIX);
    }

    /**
     * Loads the application configuration the usual way: system properties,
     * application.conf and reference.conf, in that order.
     */
    public static SwitchPortConfig load() {
        return new SwitchPortConfig(ConfigFactory.load());
    }

    public static SwitchPortConfig parse(String hocon) {
        return new SwitchPortConfig(ConfigFactory.parseString(hocon));
    }

    public ZookeeperConfig zookeeper() {
        return new ZookeeperConfig(conf.getConfig(ZookeeperConfig.GROUP_NAME));
    }

    /**
     * Whether device operations are only logged instead of being sent to
     * the switches.
     */
    public boolean dryRun() {
        return conf.getBoolean("device.dry_run");
    }

    public Config inventory() {
        return conf.getConfig("inventory");
    }
}
