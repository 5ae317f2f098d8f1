package com.infragraph.cli;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infragraph.core.provider.ProviderDescriptor;
import com.infragraph.core.provider.ProviderRegistry;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Lists the providers registered through {@code ProviderPlugin} with their resource prefixes.
 */
@Command(
    name = "providers",
    description = "List registered cloud providers",
    mixinStandardHelpOptions = true
)
public class ProvidersCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProvidersCommand.class);

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        ProviderRegistry registry = ProviderRegistry.withBuiltIns();
        List<ProviderDescriptor> descriptors = registry.descriptors();
        log.debug("Listing {} providers", descriptors.size());

        out.println("Available Providers:");
        out.println();
        if (descriptors.isEmpty()) {
            out.println("  No providers found.");
            return 0;
        }

        String defaultId = registry.defaultProvider().orElse("");
        for (ProviderDescriptor descriptor : descriptors) {
            out.printf("  • %s (ID: %s)%s%n", descriptor.displayName(), descriptor.id(),
                descriptor.id().equals(defaultId) ? " [default]" : "");
            out.printf("    Prefixes: %s%n", String.join(", ", descriptor.resourcePrefixes()));
            out.println();
        }
        return 0;
    }
}
