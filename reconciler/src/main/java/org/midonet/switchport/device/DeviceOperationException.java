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
 * A device operation failed. The message carries whatever detail the device
 * reported.
 */
public class DeviceOperationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final DeviceRequest request;

    public DeviceOperationException(DeviceRequest request, String message) {
        super(message);
        this.request = request;
    }

    public DeviceOperationException(DeviceRequest request, String message,
                                    Throwable cause) {
        super(message, cause);
        this.request = request;
    }

    /**
     * The failed request, or null if it failed before one could be built.
     */
    public DeviceRequest getRequest() {
        return request;
    }
}
