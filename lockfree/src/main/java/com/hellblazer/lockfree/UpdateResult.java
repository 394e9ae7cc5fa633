/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Luciferase.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.lockfree;

/**
 * Outcome of a bounded update.
 *
 * @author hal.hildebrand
 */
public enum UpdateResult {
    /** The mutation was published */
    SUCCESS,
    /** Every permitted attempt lost its compare-and-swap; nothing was published */
    MAX_RETRIES_EXCEEDED,
    /** The thread was interrupted while backing off; nothing was published */
    INTERRUPTED
}
