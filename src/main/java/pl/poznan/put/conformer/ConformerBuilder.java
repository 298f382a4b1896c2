package pl.poznan.put.conformer;

import com.google.common.base.Preconditions;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.poznan.put.conformer.build.BuildResult;
import pl.poznan.put.conformer.build.BuildSettings;
import pl.poznan.put.conformer.build.ConformerGenerator;
import pl.poznan.put.conformer.build.ImmutableBuildSettings;
import pl.poznan.put.conformer.build.OverflowPolicy;
import pl.poznan.put.conformer.chain.BondGeometry;
import pl.poznan.put.conformer.clash.ClashStrategy;
import pl.poznan.put.conformer.clash.ClashValidator;
import pl.poznan.put.conformer.fragment.EmptyFragmentPoolException;
import pl.poznan.put.conformer.fragment.FragmentDatabaseReader;
import pl.poznan.put.conformer.fragment.IndexedFragmentPool;
import pl.poznan.put.conformer.io.MmCifWriter;
import pl.poznan.put.conformer.io.PdbWriter;
import pl.poznan.put.conformer.io.StructureWriter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public class ConformerBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConformerBuilder.class);

  public static void main(String[] args) throws IOException, InterruptedException {
    Locale.setDefault(Locale.US);

    var options = createOptions();
    CommandLine commandLine;
    try {
      commandLine = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      System.err.println(e.getMessage());
      printHelpAndExit(options);
      return;
    }

    if (!commandLine.hasOption("db") || !commandLine.hasOption("seq")) {
      printHelpAndExit(options);
    }

    BuildSettings settings;
    int count;
    int threads;
    long seed;
    StructureWriter writer;
    try {
      settings = readSettings(commandLine);
      count = Integer.parseInt(commandLine.getOptionValue("n", "1"));
      threads =
          Integer.parseInt(
              commandLine.getOptionValue(
                  "threads", String.valueOf(Runtime.getRuntime().availableProcessors())));
      Preconditions.checkArgument(count > 0, "Number of conformers must be positive: %s", count);
      Preconditions.checkArgument(threads > 0, "Number of threads must be positive: %s", threads);
      seed =
          commandLine.hasOption("seed")
              ? Long.parseLong(commandLine.getOptionValue("seed"))
              : System.nanoTime();
      writer =
          "cif".equalsIgnoreCase(commandLine.getOptionValue("format"))
              ? new MmCifWriter()
              : new PdbWriter();
    } catch (IllegalArgumentException | IllegalStateException e) {
      System.err.println(e.getMessage());
      printHelpAndExit(options);
      return;
    }

    var database =
        FragmentDatabaseReader.readDirectory(Paths.get(commandLine.getOptionValue("db")));
    var pool = new IndexedFragmentPool(database);
    var outputDirectory = Paths.get(commandLine.getOptionValue("o", "."));
    Files.createDirectories(outputDirectory);
    LOGGER.info("Building {} conformers of {} with seed {}", count, settings.sequence(), seed);

    List<BuildResult> results;
    try (var generator =
        new ConformerGenerator(BondGeometry.standard(), pool, new ClashValidator(), threads)) {
      results = generator.generate(settings, count, seed);
    } catch (EmptyFragmentPoolException e) {
      LOGGER.error("{}; try a wider pattern with -dr", e.getMessage());
      System.exit(2);
      return;
    }

    var written = 0;
    for (var i = 0; i < results.size(); i++) {
      var result = results.get(i);
      if (!result.isComplete()) {
        LOGGER.warn(
            "Conformer {} not written: {} with {} of {} residues ({})",
            i + 1,
            result.state(),
            result.residueCount(),
            settings.residueCount(),
            result.reason().orElse(""));
        continue;
      }
      var path =
          outputDirectory.resolve(String.format("conformer_%d.%s", i + 1, writer.extension()));
      writer.write(settings.sequence(), result.chain(), path);
      written++;
      System.out.println("Output file: " + path);
    }

    if (written < results.size()) {
      System.exit(3);
    }
  }

  private static BuildSettings readSettings(CommandLine commandLine) {
    var builder =
        ImmutableBuildSettings.builder()
            .sequence(StringUtils.upperCase(commandLine.getOptionValue("seq")));
    if (commandLine.hasOption("dr")) {
      builder.patterns(Arrays.asList(commandLine.getOptionValues("dr")));
    }
    if (commandLine.hasOption("max-retries")) {
      builder.maxRetries(Integer.parseInt(commandLine.getOptionValue("max-retries")));
    }
    if (commandLine.hasOption("strategy")) {
      builder.clashStrategy(
          enumOption(ClashStrategy.class, commandLine.getOptionValue("strategy")));
    }
    if (commandLine.hasOption("overflow")) {
      builder.overflowPolicy(
          enumOption(OverflowPolicy.class, commandLine.getOptionValue("overflow")));
    }
    return builder.build();
  }

  private static <E extends Enum<E>> E enumOption(Class<E> type, String value) {
    var name = StringUtils.upperCase(StringUtils.replaceChars(value, '-', '_'));
    if (!EnumUtils.isValidEnum(type, name)) {
      throw new IllegalArgumentException(
          String.format(
              "Invalid value %s, expected one of %s", value, EnumUtils.getEnumList(type)));
    }
    return EnumUtils.getEnum(type, name);
  }

  private static Options createOptions() {
    var options = new Options();
    options.addOption("db", "database", true, "(required) directory with *.data fragment files");
    options.addOption("seq", "sequence", true, "(required) one-letter residue sequence");
    options.addOption("n", "nconfs", true, "(optional) number of conformers to build, default 1");
    options.addOption(
        Option.builder("dr")
            .longOpt("dssp-regexes")
            .hasArgs()
            .desc(
                "(optional) secondary structure regexes, each searched separately, default "
                    + BuildSettings.DEFAULT_PATTERN)
            .build());
    options.addOption("o", "output", true, "(optional) output directory, default current");
    options.addOption("s", "seed", true, "(optional) random seed");
    options.addOption(null, "max-retries", true, "(optional) clashing fragments per growth step");
    options.addOption(null, "strategy", true, "(optional) clash check: batched or incremental");
    options.addOption(null, "overflow", true, "(optional) last fragment: truncate or roll-back");
    options.addOption("f", "format", true, "(optional) output format: pdb (default) or cif");
    options.addOption("t", "threads", true, "(optional) number of worker threads");
    return options;
  }

  private static void printHelpAndExit(Options options) {
    var helpFormatter = new HelpFormatter();
    helpFormatter.printHelp("conformer-builder", options);
    System.exit(1);
  }
}
