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
package org.midonet.switchport.cluster.config;

import java.util.concurrent.TimeUnit;

import com.google.common.base.Strings;
import com.typesafe.config.Config;

/**
 * Zookeeper coordination parameters, read from the {@code zookeeper} block
 * of the configuration.
 */
public class ZookeeperConfig {

    public static final String GROUP_NAME = "zookeeper";

    private final Config conf;

    public ZookeeperConfig(Config conf) {
        this.conf = conf;
    }

    /**
     * Comma-separated string containing a host:port per zk node. Empty when
     * no coordination service is deployed, in which case locks are only
     * shared within this process.
     */
    public String hosts() {
        return conf.getString("zookeeper_hosts");
    }

    public boolean isEnabled() {
        return !Strings.isNullOrEmpty(hosts().trim());
    }

    /**
     * ZooKeeper root directory path.
     */
    public String rootKey() {
        return conf.getString("root_key");
    }

    /**
     * The timeout value of the zookeeper session, in millis.
     */
    public int sessionTimeoutMs() {
        return (int) conf.getDuration("session_timeout", TimeUnit.MILLISECONDS);
    }

    public int connectionTimeoutMs() {
        return (int) conf.getDuration("connection_timeout",
                                      TimeUnit.MILLISECONDS);
    }

    public int baseRetryMs() {
        return (int) conf.getDuration("base_retry", TimeUnit.MILLISECONDS);
    }

    public int maxRetries() {
        return conf.getInt("max_retries");
    }
}
