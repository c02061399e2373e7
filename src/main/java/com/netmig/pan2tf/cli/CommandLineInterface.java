package com.netmig.pan2tf.cli;

import com.netmig.pan2tf.config.ConfigLoader;
import com.netmig.pan2tf.config.ConversionConfig;
import com.netmig.pan2tf.emit.HclResourceEmitter;
import com.netmig.pan2tf.exception.ConversionException;
import com.netmig.pan2tf.exception.UnresolvedReferenceException;
import com.netmig.pan2tf.loader.TreeLoader;
import com.netmig.pan2tf.loader.TreeWriter;
import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.UnresolvedReference;
import com.netmig.pan2tf.model.tree.ConfigTree;
import com.netmig.pan2tf.output.TerraformWriter;
import com.netmig.pan2tf.partition.DeviceGroupPartitioner;
import com.netmig.pan2tf.partition.Partition;
import com.netmig.pan2tf.pipeline.ConversionPipeline;
import com.netmig.pan2tf.pipeline.ConversionResult;
import com.netmig.pan2tf.synth.EmittedResource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Command Line Interface handler for pan2tf
 *
 * Usage:
 *   java -jar pan2tf.jar [convert] export.xml [-o dir] [-f config] [-v]
 *   java -jar pan2tf.jar -s export.xml [-o dir]
 */
@Slf4j
public class CommandLineInterface {

    public static final String DEFAULT_OUTPUT_DIR = "terraform_output";
    public static final String DEFAULT_SPLIT_DIR = "split_configs";
    private static final String CONVERT = "convert";

    private Options options;

    public CommandLineInterface() {
        initializeOptions();
    }

    private void initializeOptions() {
        options = new Options();

        options.addOption(Option.builder("h")
                .longOpt("help")
                .desc("Display help information")
                .build());

        options.addOption(Option.builder("o")
                .longOpt("output-dir")
                .hasArg()
                .argName("dir")
                .desc("Output directory (default: ./" + DEFAULT_OUTPUT_DIR + ")")
                .build());

        options.addOption(Option.builder("f")
                .longOpt("config")
                .hasArg()
                .argName("config-file")
                .desc("Path to conversion config file (default: ./" + ConfigLoader.DEFAULT_CONFIG + ")")
                .build());

        options.addOption(Option.builder("s")
                .longOpt("split")
                .desc("Split a Panorama export into one export per device group")
                .build());

        options.addOption(Option.builder("v")
                .longOpt("verbose")
                .desc("List every emitted resource and unresolved reference")
                .build());
    }

    /**
     * Run the command and return the process exit code.
     */
    public int execute(String[] args) {
        if (args.length == 0) {
            printHelp();
            return 0;
        }

        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println("Error: " + e.getMessage());
            printHelp();
            return 1;
        }

        if (cmd.hasOption("h")) {
            printHelp();
            return 0;
        }

        List<String> arguments = new ArrayList<>(cmd.getArgList());
        if (!arguments.isEmpty() && CONVERT.equals(arguments.get(0))) {
            arguments.remove(0);
        }
        if (arguments.size() != 1) {
            System.err.println("Error: exactly one input XML file is required");
            System.err.println("Usage: java -jar pan2tf.jar [convert] <export.xml> [-o dir] [-f config] [-v]");
            return 1;
        }

        Path input = Paths.get(arguments.get(0));
        if (!Files.exists(input)) {
            System.err.println("Error: Input file not found: " + input);
            return 1;
        }

        try {
            ConversionConfig config = new ConfigLoader().load(cmd.getOptionValue("f"));
            if (cmd.hasOption("s")) {
                Path outputDir = cmd.hasOption("o") ? Paths.get(cmd.getOptionValue("o"))
                        : input.toAbsolutePath().getParent().resolve(DEFAULT_SPLIT_DIR);
                return split(input, outputDir, config);
            }
            Path outputDir = Paths.get(cmd.getOptionValue("o", DEFAULT_OUTPUT_DIR));
            return convert(input, outputDir, config, cmd.hasOption("v"));
        } catch (UnresolvedReferenceException e) {
            System.err.println("\n❌ Conversion aborted: " + e.getUnresolved().size() + " unresolved reference(s)");
            printUnresolved(e.getUnresolved());
            return 1;
        } catch (ConversionException | IOException e) {
            log.debug("Conversion failed", e);
            System.err.println("\n❌ Error: " + e.getMessage());
            return 1;
        }
    }

    private int convert(Path input, Path outputDir, ConversionConfig config, boolean verbose)
            throws IOException, ConversionException {
        System.out.println("╔══════════════════════════════════════════════════════════════════╗");
        System.out.println("║       pan2tf - PAN-OS Configuration to Terraform                 ║");
        System.out.println("╚══════════════════════════════════════════════════════════════════╝");
        System.out.println();
        System.out.println("📁 Loading export from: " + input);

        ConfigTree tree = new TreeLoader().load(input);
        System.out.printf("   ✓ %d device group(s), %d template(s), %d template stack(s), %d shared fragment(s)%n",
                tree.getCatalog().getDeviceGroups().size(), tree.getCatalog().getTemplates().size(),
                tree.getCatalog().getTemplateStacks().size(), tree.getCatalog().getShared().getBases().size());
        System.out.println();

        ConversionPipeline pipeline = new ConversionPipeline(config);
        ConversionResult result = pipeline.convert(tree);
        List<EmittedResource> emitted = pipeline.emit(result, new HclResourceEmitter(config.getSecretPlaceholder()));
        List<Path> written = new TerraformWriter(config.getProviderVersion()).write(emitted, outputDir);

        Map<Category, Integer> counts = new EnumMap<>(Category.class);
        for (CanonicalObject object : result.getObjects()) {
            counts.merge(object.getCategory(), 1, Integer::sum);
        }
        System.out.println("Found:");
        for (Map.Entry<Category, Integer> entry : counts.entrySet()) {
            System.out.printf("  - %-30s %d%n", entry.getKey().getToken(), entry.getValue());
        }
        System.out.println();

        if (verbose) {
            System.out.println("Emission order:");
            System.out.println("─────────────────────────────────────────────────────────────────");
            for (CanonicalObject object : result.getObjects()) {
                System.out.printf("  %-28s %s%s%n", object.getCategory().getToken(), object.getIdentifier(),
                        object.getDependencyIdentifiers().isEmpty()
                                ? "" : " <- " + String.join(", ", object.getDependencyIdentifiers()));
            }
            System.out.println("─────────────────────────────────────────────────────────────────");
            System.out.println();
        }

        System.out.printf("✅ Wrote %d file(s) with %d resource(s) to %s%n", written.size(), emitted.size(), outputDir);

        if (result.hasUnresolved()) {
            System.out.println();
            System.out.printf("❌ %d unresolved reference(s); %d declaration(s) were not converted%n",
                    result.getUnresolved().size(), result.getDedup().getOmitted().size());
            printUnresolved(result.getUnresolved());
            return 1;
        }
        return 0;
    }

    private int split(Path input, Path outputDir, ConversionConfig config) throws IOException, ConversionException {
        System.out.println("📁 Loading Panorama export from: " + input);
        ConfigTree tree = new TreeLoader().load(input);

        Map<String, Partition> partitions = new DeviceGroupPartitioner(
                config.getTemplatePrefixes(), config.getPartitionVersion()).partition(tree);
        if (partitions.isEmpty()) {
            System.out.println("No device groups found in the configuration.");
            System.out.println("This may be a single firewall export, not a Panorama export.");
            return 1;
        }

        System.out.printf("%nFound %d device group(s):%n", partitions.size());
        partitions.keySet().forEach(name -> System.out.println("  - " + name));

        Files.createDirectories(outputDir);
        System.out.println("\nSplitting configurations into: " + outputDir);

        TreeWriter writer = new TreeWriter();
        for (Partition partition : partitions.values()) {
            Path file = outputDir.resolve(DeviceGroupPartitioner.safeFileName(partition.getGroupName()));
            writer.write(partition.getTree(), file);
            System.out.println("\nProcessing device group: " + partition.getGroupName());
            for (String warning : partition.getWarnings()) {
                System.out.println("  ⚠ Warning: " + warning);
            }
            System.out.println("  ✓ Saved to: " + file);
        }

        System.out.printf("%n✓ Successfully split %d device group(s)%n", partitions.size());
        System.out.println("\nNext steps:");
        System.out.println("  java -jar pan2tf.jar <device-group>.xml -o <device-group>-tf");
        return 0;
    }

    private void printUnresolved(List<UnresolvedReference> unresolved) {
        for (UnresolvedReference reference : unresolved) {
            System.out.println("   • " + reference.describe());
        }
    }

    private void printHelp() {
        System.out.println("pan2tf - PAN-OS / Panorama configuration to Terraform converter");
        System.out.println();
        System.out.println("USAGE:");
        System.out.println("  # Convert an export to Terraform");
        System.out.println("  java -jar pan2tf.jar [convert] <export.xml> [OPTIONS]");
        System.out.println();
        System.out.println("  # Split a Panorama export per device group");
        System.out.println("  java -jar pan2tf.jar -s <export.xml> [-o dir]");
        System.out.println();
        System.out.println("OPTIONS:");
        System.out.println("  -h, --help              Display this help message");
        System.out.println("  -o, --output-dir DIR    Output directory");
        System.out.println("                          (default: ./" + DEFAULT_OUTPUT_DIR + ", or ./"
                + DEFAULT_SPLIT_DIR + " next to the input with -s)");
        System.out.println("  -f, --config FILE       Path to conversion config file");
        System.out.println("                          (default: ./" + ConfigLoader.DEFAULT_CONFIG + ")");
        System.out.println("  -s, --split             Write one self-contained export per device group");
        System.out.println("  -v, --verbose           List every emitted resource");
        System.out.println();
        System.out.println("EXIT CODES:");
        System.out.println("  0  success");
        System.out.println("  1  invalid arguments, unreadable input, or unresolved references");
    }
}
