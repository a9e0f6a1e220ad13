// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.examples;

import java.math.BigDecimal;
import java.time.Instant;

public record Order(String id, String customerId, BigDecimal total, Instant createdAt) {}
