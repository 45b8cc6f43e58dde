package com.lbg.markets.surveillance.hsm.backend;

import com.lbg.markets.surveillance.hsm.domain.HsmConfig;
import com.lbg.markets.surveillance.hsm.domain.HsmInterface;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * HSM configs read from {@code hsm.configs}, a list of
 * {@code storageBox:checker[:retriever]} entries, e.g.
 * {@code hsm.configs=tape-archive:FILESYSTEM,scratch:NONE}.
 * When the retriever is omitted it defaults to the checker.
 */
@ApplicationScoped
public class ConfiguredHsmConfigRegistry implements HsmConfigRegistry {

    private static final Logger LOG = Logger.getLogger(ConfiguredHsmConfigRegistry.class);

    private final List<HsmConfig> configs;

    public ConfiguredHsmConfigRegistry(
            @ConfigProperty(name = "hsm.configs") Optional<List<String>> entries
    ) {
        this.configs = parse(entries.orElse(List.of()));
        LOG.debugf("Loaded %d HSM storage box configs", configs.size());
    }

    @Override
    public List<HsmConfig> findByStorageBox(String storageBoxId) {
        return configs.stream()
                .filter(config -> config.storageBoxId().equals(storageBoxId))
                .toList();
    }

    static List<HsmConfig> parse(List<String> entries) {
        List<HsmConfig> parsed = new ArrayList<>();
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String[] parts = entry.trim().split(":");
            if (parts.length < 2 || parts.length > 3) {
                throw new IllegalArgumentException(
                        "Invalid hsm.configs entry '" + entry + "', expected storageBox:checker[:retriever]");
            }
            HsmInterface checker = toInterface(parts[1], entry);
            HsmInterface retriever = parts.length == 3 ? toInterface(parts[2], entry) : checker;
            parsed.add(new HsmConfig(parts[0].trim(), checker, retriever));
        }
        return List.copyOf(parsed);
    }

    private static HsmInterface toInterface(String name, String entry) {
        try {
            return HsmInterface.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown HSM interface '" + name + "' in hsm.configs entry '" + entry + "'", e);
        }
    }
}
