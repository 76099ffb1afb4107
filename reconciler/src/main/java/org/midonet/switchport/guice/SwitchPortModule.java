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
package org.midonet.switchport.guice;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.PrivateModule;
import com.google.inject.Scopes;

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;

import org.midonet.switchport.cluster.LocalLockFactory;
import org.midonet.switchport.cluster.LockFactory;
import org.midonet.switchport.cluster.ZookeeperLockFactory;
import org.midonet.switchport.cluster.config.ZookeeperConfig;
import org.midonet.switchport.cluster.data.neutron.NeutronStore;
import org.midonet.switchport.config.SwitchPortConfig;
import org.midonet.switchport.device.DeviceGateway;
import org.midonet.switchport.device.LoggingDeviceGateway;
import org.midonet.switchport.driver.SwitchPortMechanismDriver;
import org.midonet.switchport.driver.TrunkHandler;
import org.midonet.switchport.inventory.SwitchInventory;
import org.midonet.switchport.services.SwitchPortService;
import org.midonet.switchport.state.NetworkLifecycleHandler;
import org.midonet.switchport.state.PortStateReconciler;
import org.midonet.switchport.topology.TopologyResolver;

/**
 * Main switch port reconciler module. The embedding application provides
 * the {@link NeutronStore}.
 */
public class SwitchPortModule extends PrivateModule {

    private final SwitchPortConfig config;

    public SwitchPortModule(SwitchPortConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        binder().requireExplicitBindings();

        requireBinding(NeutronStore.class);

        bind(SwitchPortConfig.class).toInstance(config);
        expose(SwitchPortConfig.class);

        bind(ZookeeperConfig.class).toInstance(config.zookeeper());

        bind(SwitchInventory.class)
            .toInstance(SwitchInventory.fromConfig(config.inventory()));
        expose(SwitchInventory.class);

        bind(MetricRegistry.class).toInstance(new MetricRegistry());
        expose(MetricRegistry.class);

        bindLockFactory();
        bindDeviceGateway();

        bind(TopologyResolver.class).in(Scopes.SINGLETON);
        bind(PortStateReconciler.class).in(Scopes.SINGLETON);
        bind(NetworkLifecycleHandler.class).in(Scopes.SINGLETON);

        bind(SwitchPortMechanismDriver.class).in(Scopes.SINGLETON);
        expose(SwitchPortMechanismDriver.class);

        bind(TrunkHandler.class).in(Scopes.SINGLETON);
        expose(TrunkHandler.class);

        bind(SwitchPortService.class).asEagerSingleton();
        expose(SwitchPortService.class);
    }

    /**
     * Switches are locked through ZooKeeper when it is configured, so that
     * every node running the driver is serialized, and within this process
     * otherwise.
     */
    protected void bindLockFactory() {
        ZookeeperConfig zkConfig = config.zookeeper();
        if (zkConfig.isEnabled()) {
            bind(CuratorFramework.class).toInstance(newCurator(zkConfig));
            bind(LockFactory.class).to(ZookeeperLockFactory.class)
                .in(Scopes.SINGLETON);
        } else {
            bind(LockFactory.class).to(LocalLockFactory.class)
                .in(Scopes.SINGLETON);
        }
        expose(LockFactory.class);
    }

    /**
     * Binds the {@link DeviceGateway}. Only the dry run gateway ships with
     * the reconciler; deployments that drive real switches override this.
     */
    protected void bindDeviceGateway() {
        if (!config.dryRun()) {
            addError("No device gateway is available when "
                     + "switchport.device.dry_run is false, override "
                     + "SwitchPortModule.bindDeviceGateway()");
            return;
        }
        bind(LoggingDeviceGateway.class).in(Scopes.SINGLETON);
        bind(DeviceGateway.class).to(LoggingDeviceGateway.class);
        expose(DeviceGateway.class);
        expose(LoggingDeviceGateway.class);
    }

    private static CuratorFramework newCurator(ZookeeperConfig zkConfig) {
        // Not started here, the SwitchPortService takes care of that.
        return CuratorFrameworkFactory.builder()
            .connectString(zkConfig.hosts())
            .sessionTimeoutMs(zkConfig.sessionTimeoutMs())
            .connectionTimeoutMs(zkConfig.connectionTimeoutMs())
            .retryPolicy(new ExponentialBackoffRetry(zkConfig.baseRetryMs(),
                                                     zkConfig.maxRetries()))
            .build();
    }
}
