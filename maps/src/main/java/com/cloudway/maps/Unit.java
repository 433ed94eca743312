/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

/**
 * The placeholder value stored by sets that are built on top of a map.
 */
public enum Unit {
    /**
     * The only value of the unit type.
     */
    U;

    public String toString() {
        return "()";
    }
}
