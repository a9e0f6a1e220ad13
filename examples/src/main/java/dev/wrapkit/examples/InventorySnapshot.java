// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.examples;

/** Stock level of one warehouse, as reported by an inventory backend. */
public record InventorySnapshot(String warehouse, int available, boolean stale) {}
