/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.StringJoiner;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * Renders keys and values the way they would be written as Java literals.
 */
final class Literals
{
    private Literals() {}

    private static final Escaper STRING_ESCAPER = controlEscapes()
        .addEscape('"', "\\\"")
        .build();

    private static final Escaper CHAR_ESCAPER = controlEscapes()
        .addEscape('\'', "\\'")
        .build();

    private static Escapers.Builder controlEscapes() {
        return Escapers.builder()
            .addEscape('\\', "\\\\")
            .addEscape('\n', "\\n")
            .addEscape('\r', "\\r")
            .addEscape('\t', "\\t");
    }

    static String format(Object x) {
        if (x instanceof CharSequence) {
            return '"' + STRING_ESCAPER.escape(x.toString()) + '"';
        } else if (x instanceof Character) {
            return "'" + CHAR_ESCAPER.escape(x.toString()) + "'";
        } else {
            return String.valueOf(x);
        }
    }

    static String formatMap(MapLike<?,?> m) {
        StringJoiner sj = new StringJoiner(",", "{", "}");
        m.range((k, v) -> {
            sj.add(format(k) + ":" + format(v));
            return true;
        });
        return sj.toString();
    }

    static String formatSet(SetLike<?> s) {
        StringJoiner sj = new StringJoiner(",", "{", "}");
        s.range(e -> {
            sj.add(format(e));
            return true;
        });
        return sj.toString();
    }
}
