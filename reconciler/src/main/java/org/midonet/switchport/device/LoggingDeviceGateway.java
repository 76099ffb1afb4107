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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.switchport.inventory.SwitchInventory;

/**
 * Dry run gateway: logs every request instead of sending it to the device,
 * and keeps them for inspection.
 */
public class LoggingDeviceGateway extends AbstractDeviceGateway {

    private static final Logger log =
        LoggerFactory.getLogger(LoggingDeviceGateway.class);

    private final List<DeviceRequest> requests = new CopyOnWriteArrayList<>();

    @Inject
    public LoggingDeviceGateway(SwitchInventory inventory) {
        super(inventory);
    }

    @Override
    protected void execute(DeviceRequest request) {
        log.info("[dry run] {} on switch {}: {}", request.operation,
                 request.switchName, request);
        requests.add(request);
    }

    /**
     * @return The requests executed so far, oldest first.
     */
    public List<DeviceRequest> getRequests() {
        return new ArrayList<>(requests);
    }

    public void clear() {
        requests.clear();
    }
}
