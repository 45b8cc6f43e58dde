package com.lbg.markets.surveillance.hsm.probe;

import com.lbg.markets.surveillance.hsm.domain.ProbeResult;
import com.lbg.markets.surveillance.hsm.util.Outcome;

import java.nio.file.Path;

/**
 * Reads logical size and allocated block count for a path without reading its content.
 * Failures are returned as {@link com.lbg.markets.surveillance.hsm.error.ProbeException}.
 */
public interface StatProbe {

    Outcome<ProbeResult> probe(Path path);
}
