/*
 * Copyright (c) 2025, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of VCD2PWL.
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

package com.vcd2pwl.vcd;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vcd2pwl.util.FileTools;

/**
 * Builds a {@link VCDDocument} from the token stream of a VCD trace. It is intended for
 * traces written by common RTL simulators and only models what is needed to export the
 * top module: one top scope, a flat list of side scopes and reg/wire variables.
 *
 * A parser reads its input once; create a new parser for every trace.
 */
public class VCDParser implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger();

    private final VCDLexer lexer;

    private boolean trackAll = false;

    private boolean consumed = false;

    public VCDParser(Path fileName) {
        this(fileName, FileTools.getInputStream(fileName));
    }

    public VCDParser(String fileName) {
        this(Paths.get(fileName));
    }

    public VCDParser(InputStream in) {
        this(null, in);
    }

    public VCDParser(Path fileName, InputStream in) {
        this.lexer = new VCDLexer(fileName, in);
    }

    public VCDParser(VCDLexer lexer) {
        this.lexer = lexer;
    }

    /**
     * @return True if value changes of every scope are recorded.
     */
    public boolean isTrackAll() {
        return trackAll;
    }

    /**
     * By default only the signals of the top module are recorded and value changes of any
     * other identifier are dropped. When tracking everything, value changes are recorded
     * for all declared scopes and an identifier that was never declared is an error.
     * @param trackAll True to record every scope.
     */
    public void setTrackAll(boolean trackAll) {
        this.trackAll = trackAll;
    }

    /**
     * Reads the whole trace. The underlying stream is closed when this method returns,
     * whether it succeeds or not.
     * @return The populated document.
     * @throws VCDParseException If the trace is malformed or inconsistent.
     */
    public VCDDocument parse() {
        if (consumed) {
            throw new IllegalStateException("ERROR: This parser has already read its input");
        }
        consumed = true;
        VCDParserState state = new VCDParserState(new VCDDocument(), trackAll);
        try (VCDLexer l = lexer) {
            while (l.hasNext()) {
                state = step(state, l.next());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem closing VCD input", e);
        }
        return state.getDocument();
    }

    private VCDParserState step(VCDParserState state, VCDToken token) {
        return switch (token.getKind()) {
            case DATE -> onDate(state, token);
            case VERSION -> onVersion(state, token);
            case TIMESCALE -> onTimeScale(state, token);
            case SCOPE -> onScope(state, token);
            case UPSCOPE -> onUpScope(state);
            case VAR -> onVar(state, token);
            case CHANGE_TIME -> onTime(state, token);
            case CHANGE_SCALAR, CHANGE_VECTOR -> onValueChange(state, token);
            case CHANGE_REAL, CHANGE_STRING -> onUnsupportedChange(state, token);
            case COMMENT, ENDDEFINITIONS, DUMPVARS, DUMP_CONTROL -> state;
        };
    }

    private VCDParserState onDate(VCDParserState state, VCDToken token) {
        state.getDocument().setDate(token.getText());
        return state;
    }

    private VCDParserState onVersion(VCDParserState state, VCDToken token) {
        state.getDocument().setVersion(token.getText());
        return state;
    }

    private VCDParserState onTimeScale(VCDParserState state, VCDToken token) {
        logger.info("Setting timescale: " + token.getText());
        state.getDocument().setTimeScale(TimeScale.parse(token.getText()));
        return state;
    }

    private VCDParserState onScope(VCDParserState state, VCDToken token) {
        String name = token.getScope().getIdent();
        logger.debug("Enter scope: " + name);
        Scope s = state.getDocument().openScope(name);
        if (s != null) {
            state.setCurrentScope(s);
        }
        return state;
    }

    private VCDParserState onUpScope(VCDParserState state) {
        Scope current = state.getCurrentScope();
        if (current != null && current == state.getDocument().getTop()) {
            logger.info("Using reg: " + current.getSignals().stream()
                    .map(Signal::toString).collect(Collectors.joining(", ")));
        }
        logger.debug("Leaving scope: " + current);
        state.setCurrentScope(null);
        return state;
    }

    private VCDParserState onVar(VCDParserState state, VCDToken token) {
        VCDVarDecl decl = token.getVar();
        SignalKind kind = SignalKind.fromVCDType(decl.getType());
        if (kind == null) {
            logger.debug("Skipping variable of type '" + decl.getType() + "': " + decl);
            return state;
        }
        Scope scope = state.getCurrentScope();
        if (scope == null) {
            logger.warn("Variable declared outside of any open scope, ignored: " + decl);
            return state;
        }
        Signal signal = new Signal(decl.getReference(), kind, decl.getSize());
        logger.debug("  declare " + kind.getVCDType() + ": " + decl.getIdCode() + " -> " + signal
                + " | scope: " + scope);
        state.getDocument().addSignal(scope, decl.getIdCode(), signal);
        return state;
    }

    private VCDParserState onTime(VCDParserState state, VCDToken token) {
        state.setCurrentTick(token.getTime());
        return state;
    }

    private VCDParserState onValueChange(VCDParserState state, VCDToken token) {
        VCDDocument doc = state.getDocument();
        TimeScale timeScale = doc.getTimeScale();
        if (timeScale == null) {
            throw new VCDParseException(token, "ERROR: Value change found before any $timescale declaration");
        }
        VCDValueChange change = token.getChange();
        String id = change.getIdCode();
        if (!state.isTrackAll() && !doc.isTopIdentifier(id)) {
            // Intermediary signal outside of the top module
            return state;
        }

        List<Signal> targets = doc.resolve(id, !state.isTrackAll());
        if (targets.isEmpty()) {
            throw new VCDParseException(token, "ERROR: Un-recognized identifier: " + id);
        }

        if (change.isAmbiguous()) {
            for (Signal s : targets) {
                logger.warn("\t" + s + ": Skipping ambiguous signal value definition, during update timing "
                        + "assignment: " + change.getValue());
                s.markAmbiguous();
            }
            return state;
        }

        BigInteger value = new BigInteger(change.getValue(), 2);
        long tick = state.getCurrentTick();
        for (Signal s : targets) {
            s.update(tick, value);
            if (logger.isDebugEnabled()) {
                logger.debug("Setting " + s.getName() + " to '" + value + "' at time: "
                        + timeScale.convert(tick, TimeScale.Unit.NS) + TimeScale.Unit.NS);
            }
        }
        return state;
    }

    private VCDParserState onUnsupportedChange(VCDParserState state, VCDToken token) {
        logger.debug("Un-supported data type, ignored: " + token);
        return state;
    }

    @Override
    public void close() throws IOException {
        lexer.close();
    }
}
