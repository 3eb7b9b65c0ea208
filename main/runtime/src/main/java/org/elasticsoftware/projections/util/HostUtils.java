/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.projections.util;

import java.net.InetAddress;
import java.net.UnknownHostException;

public final class HostUtils {
    private HostUtils() {
    }

    /**
     * The container host name when set, the local host name otherwise. Used to give Kafka clients a stable,
     * recognizable client id.
     */
    public static String getHostName() {
        String hostName = System.getenv("HOSTNAME");
        if (hostName != null && !hostName.isEmpty()) {
            return hostName;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }
}
