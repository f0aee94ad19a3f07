package com.hdlcov.instrument;

import com.hdlcov.netlist.NetlistException;
import com.hdlcov.netlist.Node;

/** Builds the exception for an internal error; callers write {@code throw reporter.fatal(node, msg)}. */
@FunctionalInterface
public interface FatalErrorReporter {

    FatalErrorReporter DEFAULT = NetlistException::new;

    RuntimeException fatal(Node node, String message);
}
