package com.lbg.markets.surveillance.hsm.probe;

import com.lbg.markets.surveillance.hsm.domain.ProbeResult;
import com.lbg.markets.surveillance.hsm.error.ProbeException;
import com.lbg.markets.surveillance.hsm.util.Outcome;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jnr.posix.FileStat;
import jnr.posix.POSIX;
import jnr.posix.POSIXFactory;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stat probe backed by native stat(2) through jnr-posix.
 * When no native POSIX layer can be loaded, falls back to running the
 * {@code stat} command and parsing its human-readable output.
 */
@ApplicationScoped
public class PosixStatProbe implements StatProbe {

    private static final Logger LOG = Logger.getLogger(PosixStatProbe.class);

    private static final Pattern SIZE_AND_BLOCKS = Pattern.compile("^.*Size: (\\d+).*Blocks: (\\d+).*$");

    private final POSIX posix;
    private final String statCommand;

    @Inject
    public PosixStatProbe() {
        this(POSIXFactory.getPOSIX(), "stat");
    }

    public PosixStatProbe(POSIX posix, String statCommand) {
        this.posix = posix;
        this.statCommand = statCommand;
    }

    @Override
    public Outcome<ProbeResult> probe(Path path) {
        return Outcome.attempt(() -> posix != null && posix.isNative()
                ? statNative(path)
                : statCommand(path));
    }

    boolean usesNativeStat() {
        return posix != null && posix.isNative();
    }

    private ProbeResult statNative(Path path) throws ProbeException {
        FileStat stat = posix.allocateStat();
        int rc = posix.stat(path.toString(), stat);
        if (rc < 0) {
            throw new ProbeException(path, "stat failed with errno " + posix.errno());
        }
        return new ProbeResult(stat.st_size(), stat.blocks());
    }

    private ProbeResult statCommand(Path path) throws ProbeException {
        LOG.debugf("Native stat unavailable, running %s for %s", statCommand, path);

        List<String> lines = new ArrayList<>();
        Process process;
        try {
            process = new ProcessBuilder(statCommand, path.toString())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new ProbeException(path, "Unable to run " + statCommand, e);
        }

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
            process.waitFor();
        } catch (IOException e) {
            throw new ProbeException(path, "Unable to read " + statCommand + " output", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeException(path, "Interrupted waiting for " + statCommand, e);
        }

        return parseStatOutput(lines)
                .orElseThrow(() -> new ProbeException(path, "Unable to detect size and blocks"));
    }

    /**
     * Find the first line carrying both a "Size:" and a "Blocks:" field.
     */
    static Optional<ProbeResult> parseStatOutput(List<String> lines) {
        for (String line : lines) {
            Matcher matcher = SIZE_AND_BLOCKS.matcher(line);
            if (matcher.matches()) {
                return Optional.of(new ProbeResult(
                        Long.parseLong(matcher.group(1)),
                        Long.parseLong(matcher.group(2))));
            }
        }
        return Optional.empty();
    }
}
