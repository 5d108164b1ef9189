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

package com.xilinx.rapidfabric.netlist;

import com.xilinx.rapidfabric.util.MessageGenerator;
import com.xilinx.rapidfabric.util.Params;

/**
 * Options of the fabric netlist writers. The naming tools never look at these
 * options; they are handed over untouched to the Verilog and SPICE writers.
 * Modifications of default values can be done by adding corresponding options
 * to the arguments. Each option name must start with two dashes.
 */
public class FabricNetlistOptions {
    /** Directory the netlists are written to */
    private String outputDirectory;
    /** true to emit code that the Icarus simulator accepts */
    private boolean supportIcarusSimulator;
    /** true to annotate timing in the netlists */
    private boolean includeTiming;
    /** true to initialize signals for simulation */
    private boolean includeSignalInit;
    /** true to connect instance ports by name instead of by position */
    private boolean explicitPortMapping;
    /** true to only write unique routing blocks */
    private boolean compressRouting;
    /** true to display more info while writing */
    private boolean verbose;

    /** Constructs an options Object with default values, then applies the arguments */
    public FabricNetlistOptions(String[] arguments) {
        outputDirectory = Params.getParamOrDefaultSetting(Params.RAPIDFABRIC_OUTPUT_DIR_NAME,
                Params.RAPIDFABRIC_DEFAULT_OUTPUT_DIR);
        supportIcarusSimulator = false;
        includeTiming = false;
        includeSignalInit = false;
        explicitPortMapping = false;
        compressRouting = false;
        verbose = Params.isParamSet(Params.RAPIDFABRIC_VERBOSE_NAME);
        if (arguments != null) {
            parseArguments(arguments);
        }
    }

    private void parseArguments(String[] arguments) {
        for (int i = 0; i < arguments.length; i++) {
            String arg = arguments[i];
            switch(arg) {
            case "--outputDirectory":
                if (i + 1 >= arguments.length) {
                    throw new IllegalArgumentException("ERROR: Option '" + arg + "' requires a directory.");
                }
                setOutputDirectory(arguments[++i]);
                break;
            case "--supportIcarusSimulator":
                setSupportIcarusSimulator(true);
                break;
            case "--includeTiming":
                setIncludeTiming(true);
                break;
            case "--includeSignalInit":
                setIncludeSignalInit(true);
                break;
            case "--explicitPortMapping":
                setExplicitPortMapping(true);
                break;
            case "--compressRouting":
                setCompressRouting(true);
                break;
            case "--verbose":
                setVerbose(true);
                break;
            default:
                throw new IllegalArgumentException("ERROR: Fabric netlist argument '" + arg + "' not recognized.");
            }
        }
    }

    /**
     * Gets the directory the netlists are written to.
     * Default: the value of RAPIDFABRIC_OUTPUT_DIR, or the current directory.
     * Can be modified by using "--outputDirectory" option, e.g. "--outputDirectory out/verilog".
     * @return The output directory.
     */
    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /**
     * Checks if the netlists must be accepted by the Icarus simulator.
     * Default: false. Can be enabled by adding "--supportIcarusSimulator" to the arguments.
     * @return true, if the writers avoid constructs Icarus does not support.
     */
    public boolean isSupportIcarusSimulator() {
        return supportIcarusSimulator;
    }

    public void setSupportIcarusSimulator(boolean supportIcarusSimulator) {
        this.supportIcarusSimulator = supportIcarusSimulator;
    }

    /**
     * Checks if timing annotations are written.
     * Default: false. Can be enabled by adding "--includeTiming" to the arguments.
     * @return true, if the netlists include timing.
     */
    public boolean isIncludeTiming() {
        return includeTiming;
    }

    public void setIncludeTiming(boolean includeTiming) {
        this.includeTiming = includeTiming;
    }

    /**
     * Checks if signal initialization is written.
     * Default: false. Can be enabled by adding "--includeSignalInit" to the arguments.
     * @return true, if the netlists initialize signals.
     */
    public boolean isIncludeSignalInit() {
        return includeSignalInit;
    }

    public void setIncludeSignalInit(boolean includeSignalInit) {
        this.includeSignalInit = includeSignalInit;
    }

    /**
     * Checks if instance ports are connected by name.
     * Default: false. Can be enabled by adding "--explicitPortMapping" to the arguments.
     * @return true, if ports are mapped explicitly.
     */
    public boolean isExplicitPortMapping() {
        return explicitPortMapping;
    }

    public void setExplicitPortMapping(boolean explicitPortMapping) {
        this.explicitPortMapping = explicitPortMapping;
    }

    /**
     * Checks if only unique routing blocks are written.
     * Default: false. Can be enabled by adding "--compressRouting" to the arguments.
     * @return true, if routing blocks are compressed.
     */
    public boolean isCompressRouting() {
        return compressRouting;
    }

    public void setCompressRouting(boolean compressRouting) {
        this.compressRouting = compressRouting;
    }

    /**
     * Checks if more info is displayed while writing.
     * Default: false, unless RAPIDFABRIC_VERBOSE is set. Can be enabled by adding "--verbose" to the arguments.
     * @return true, if verbose output is on.
     */
    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        s.append(MessageGenerator.formatString("Fabric Netlist Options"));
        s.append(MessageGenerator.formatString("Output directory: ", outputDirectory));
        s.append(MessageGenerator.formatString("Support Icarus simulator: ", supportIcarusSimulator));
        s.append(MessageGenerator.formatString("Include timing: ", includeTiming));
        s.append(MessageGenerator.formatString("Include signal init: ", includeSignalInit));
        s.append(MessageGenerator.formatString("Explicit port mapping: ", explicitPortMapping));
        s.append(MessageGenerator.formatString("Compress routing: ", compressRouting));
        s.append(MessageGenerator.formatString("Verbose: ", verbose));
        return s.toString();
    }
}
