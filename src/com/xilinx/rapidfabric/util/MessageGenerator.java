/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidFabric.
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
 *
 */

package com.xilinx.rapidfabric.util;

/**
 * Common class for generating console messages.
 */
public class MessageGenerator {

    /** Column width used to align the key of {@link #formatString(String, Object)} */
    public static final int KEY_COLUMN_WIDTH = 40;

    /** Width of the banner text printed by {@link #printHeader(String)} */
    public static final int HEADER_WIDTH = 72;

    /**
     * Used as a general way to create an error message and send it to
     * std.err. Exits the program.
     * @param msg The message to print to standard error
     */
    public static void briefErrorAndExit(String msg) {
        briefError(msg);
        System.exit(1);
    }

    /**
     * Used as a general way to create an error message and send it to
     * std.err.
     * @param msg The message to print to standard error
     */
    public static void briefError(String msg) {
        System.err.println(msg);
    }

    /**
     * Used as a general way to create a message and send it to
     * std.out.
     * @param msg The message to print to standard out
     */
    public static void briefMessage(String msg) {
        System.out.println(msg);
    }

    /**
     * Formats a single line with no value, used as a title inside a larger report.
     * @param s The text of the line.
     * @return The text terminated with a new line.
     */
    public static String formatString(String s) {
        return s + "\n";
    }

    /**
     * Formats a key/value line with the key left aligned to a fixed column.
     * @param key The description of the value.
     * @param value The value to print, rendered with its toString().
     * @return The aligned line terminated with a new line.
     */
    public static String formatString(String key, Object value) {
        return String.format("%-" + KEY_COLUMN_WIDTH + "s %s\n", key, value);
    }

    /**
     * Prints a generic header to standard out to separate operations.
     * @param s The title of the header.
     */
    public static void printHeader(String s) {
        System.out.print(createHeader(s));
    }

    /**
     * Creates the three line banner printed by {@link #printHeader(String)}.
     * @param s The title of the header.
     * @return The banner, each line terminated with a new line.
     */
    public static String createHeader(String s) {
        String bar = "==============================================================================";
        double whiteSpace = (HEADER_WIDTH - s.length()) / 2.0;
        String left = makeWhiteSpace((int) (whiteSpace));
        String right = makeWhiteSpace((int) (whiteSpace + 0.5));
        return bar + "\n" + "== " + left + s + right + " ==\n" + bar + "\n";
    }

    /**
     * Creates a whitespace string with length number of spaces.
     * @param length Number of spaces in the string.
     * @return The newly created whitespace string.
     */
    public static String makeWhiteSpace(int length) {
        if (length < 1)
            return "";
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(" ");
        }
        return sb.toString();
    }
}
