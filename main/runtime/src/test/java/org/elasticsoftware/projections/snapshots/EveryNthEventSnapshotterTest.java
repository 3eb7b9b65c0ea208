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

package org.elasticsoftware.projections.snapshots;

import org.elasticsoftware.projections.wallet.Wallet;
import org.elasticsoftware.projections.wallet.WalletRecords;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EveryNthEventSnapshotterTest {
    static class SavingsWallet extends Wallet {
    }

    private final List<String> written = new ArrayList<>();
    private final EveryNthEventSnapshotter snapshotter = new EveryNthEventSnapshotter(Wallet.class, 3, written::add);

    @Test
    void testTakesSnapshotEveryNthEvent() {
        assertFalse(snapshotter.shouldTakeSnapshot(Wallet.class, WalletRecords.credited("wallet-1", 0, 1, 10)));
        assertFalse(snapshotter.shouldTakeSnapshot(Wallet.class, WalletRecords.credited("wallet-1", 1, 1, 20)));
        assertTrue(snapshotter.shouldTakeSnapshot(Wallet.class, WalletRecords.credited("wallet-1", 2, 1, 30)));
        assertTrue(snapshotter.shouldTakeSnapshot(SavingsWallet.class, WalletRecords.credited("wallet-2", 5, 1, 40)));
    }

    @Test
    void testOtherAggregateTypes() {
        assertFalse(snapshotter.shouldTakeSnapshot(String.class, WalletRecords.credited("wallet-1", 2, 1, 30)));
    }

    @Test
    void testTakeDelegatesToWriter() throws Exception {
        snapshotter.take("wallet-1");
        assertEquals(List.of("wallet-1"), written);
    }

    @Test
    void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new EveryNthEventSnapshotter(Wallet.class, 0, written::add));
    }
}
