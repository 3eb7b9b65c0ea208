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

package org.elasticsoftware.projections.wallet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.projections.log.Position;
import org.elasticsoftware.projections.log.RecordedEvent;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

public final class WalletRecords {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private WalletRecords() {
    }

    public static byte[] toJson(Object event) {
        try {
            return objectMapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static byte[] walletMetadata(boolean snapshot) {
        return ("{\"AggregateType\":\"Wallet\",\"AggregateAssemblyQualifiedName\":\"" + Wallet.class.getName()
                + ", Wallets\",\"IsSnapshot\":" + snapshot + "}").getBytes(StandardCharsets.UTF_8);
    }

    public static RecordedEvent created(String walletId, long eventNumber, long position) {
        return new RecordedEvent(walletId, eventNumber, UUID.randomUUID(), "WalletCreated",
                toJson(new WalletCreatedEvent(walletId, "EUR")), walletMetadata(false), Position.of(position));
    }

    public static RecordedEvent credited(String walletId, long eventNumber, long amount, long position) {
        return credited(walletId, eventNumber, amount, position, false);
    }

    public static RecordedEvent credited(String walletId, long eventNumber, long amount, long position, boolean snapshot) {
        return new RecordedEvent(walletId, eventNumber, UUID.randomUUID(), "WalletCredited",
                toJson(new WalletCreditedEvent(walletId, amount)), walletMetadata(snapshot), Position.of(position));
    }

    public static RecordedEvent system(String eventType, long position) {
        return new RecordedEvent("$stats", 0, UUID.randomUUID(), eventType, new byte[0], null, Position.of(position));
    }
}
