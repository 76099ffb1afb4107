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

import com.google.inject.AbstractModule;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.junit.Before;
import org.junit.Test;

import org.midonet.switchport.NeutronFixtures;
import org.midonet.switchport.cluster.LocalLockFactory;
import org.midonet.switchport.cluster.LockFactory;
import org.midonet.switchport.cluster.data.neutron.MockNeutronStore;
import org.midonet.switchport.cluster.data.neutron.Network;
import org.midonet.switchport.cluster.data.neutron.NeutronStore;
import org.midonet.switchport.config.SwitchPortConfig;
import org.midonet.switchport.device.DeviceGateway;
import org.midonet.switchport.device.DeviceOperation;
import org.midonet.switchport.device.LoggingDeviceGateway;
import org.midonet.switchport.driver.NetworkContext;
import org.midonet.switchport.driver.SwitchPortMechanismDriver;
import org.midonet.switchport.driver.TrunkHandler;
import org.midonet.switchport.inventory.SwitchInventory;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

public class SwitchPortModuleTest {

    private MockNeutronStore store;

    @Before
    public void setUp() {
        store = new MockNeutronStore();
    }

    private static SwitchPortConfig config(String extra) {
        String inventory = NeutronFixtures.INVENTORY;
        return SwitchPortConfig.parse(
            "switchport.inventory {\n" + inventory + "}\n" + extra);
    }

    private Injector injector(SwitchPortModule module) {
        return Guice.createInjector(
            new AbstractModule() {
                @Override
                protected void configure() {
                    bind(NeutronStore.class).toInstance(store);
                }
            },
            module);
    }

    @Test
    public void testDefaultBindings() {
        Injector injector = injector(new SwitchPortModule(config("")));

        assertThat(injector.getInstance(LockFactory.class),
                   instanceOf(LocalLockFactory.class));
        assertThat(injector.getInstance(DeviceGateway.class),
                   sameInstance((DeviceGateway) injector.getInstance(
                       LoggingDeviceGateway.class)));
        assertThat(injector.getInstance(SwitchInventory.class).switches()
                       .size(), is(3));
        assertThat(injector.getInstance(SwitchPortMechanismDriver.class),
                   sameInstance(injector.getInstance(
                       SwitchPortMechanismDriver.class)));
        assertThat(injector.getInstance(TrunkHandler.class),
                   sameInstance(injector.getInstance(TrunkHandler.class)));
    }

    @Test
    public void testDriverRunsAgainstBoundStore() throws Exception {
        Injector injector = injector(new SwitchPortModule(config("")));
        SwitchPortMechanismDriver driver =
            injector.getInstance(SwitchPortMechanismDriver.class);
        final Network net = NeutronFixtures.vlanNetwork(store, 100,
                                                        NeutronFixtures.PHYSNET);

        driver.createNetworkPostcommit(new NetworkContext() {
            @Override
            public Network current() {
                return net;
            }
        });

        LoggingDeviceGateway gateway =
            injector.getInstance(LoggingDeviceGateway.class);
        assertThat(gateway.getRequests().size(), is(2));
        assertThat(gateway.getRequests().get(0).operation,
                   is(DeviceOperation.CREATE_VLAN));
    }

    @Test
    public void testGatewayCanBeOverridden() {
        final DeviceGateway custom =
            new LoggingDeviceGateway(NeutronFixtures.inventory());
        Injector injector = injector(
            new SwitchPortModule(config("switchport.device.dry_run = false")) {
                @Override
                protected void bindDeviceGateway() {
                    bind(DeviceGateway.class).toInstance(custom);
                    expose(DeviceGateway.class);
                }
            });

        assertThat(injector.getInstance(DeviceGateway.class),
                   sameInstance(custom));
    }

    @Test(expected = CreationException.class)
    public void testNoGatewayWithoutDryRun() {
        injector(new SwitchPortModule(
            config("switchport.device.dry_run = false")));
    }

    @Test(expected = CreationException.class)
    public void testStoreMustBeBound() {
        Guice.createInjector(new SwitchPortModule(config("")));
    }
}
