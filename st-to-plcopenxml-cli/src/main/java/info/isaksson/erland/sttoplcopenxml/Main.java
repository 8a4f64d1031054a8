package info.isaksson.erland.sttoplcopenxml;

import info.isaksson.erland.sttoplcopenxml.core.StToPlcOpenXmlOptions;
import info.isaksson.erland.sttoplcopenxml.core.StToPlcOpenXmlResult;
import info.isaksson.erland.sttoplcopenxml.core.StToPlcOpenXmlService;
import info.isaksson.erland.sttoplcopenxml.model.StFunctionBlock;
import info.isaksson.erland.sttoplcopenxml.model.StModelJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * CLI entrypoint: converts one Structured Text function block source into a PLCopen XML project.
 */
public final class Main {

    private static final StToPlcOpenXmlService SERVICE = new StToPlcOpenXmlService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.input == null || parsed.output == null) {
            System.err.println("Error: <input.st> and <output.xml> are required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path inputPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.isRegularFile(inputPath)) {
            System.err.println("Error: input file does not exist: " + inputPath);
            return 1;
        }
        final Path outputPath = Paths.get(parsed.output).toAbsolutePath().normalize();

        final StToPlcOpenXmlOptions opts = toCoreOptions(parsed);
        final StToPlcOpenXmlResult res;
        try {
            if (parsed.fromModel) {
                StFunctionBlock model;
                try {
                    model = StModelJson.read(inputPath);
                } catch (NoSuchFileException e) {
                    System.err.println("Error: input file does not exist: " + inputPath);
                    return 1;
                } catch (IOException e) {
                    System.err.println("Error: could not read model JSON: " + inputPath);
                    System.err.println(e.getMessage());
                    return 2;
                }
                res = SERVICE.convertModel(model, opts);
                SERVICE.write(res, outputPath);
            } else {
                res = SERVICE.convertToFile(inputPath, outputPath, opts).result;
            }
        } catch (NoSuchFileException e) {
            System.err.println("Error: input file does not exist: " + e.getFile());
            return 1;
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: conversion failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        // Optional: export the extracted model as JSON
        if (parsed.writeModel != null) {
            final Path modelOut = Paths.get(parsed.writeModel).toAbsolutePath().normalize();
            try {
                StModelJson.write(res.functionBlock, modelOut);
            } catch (IOException e) {
                System.err.println("Error: could not write model JSON to: " + modelOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        System.out.println(
                "st-to-plcopenxml" + (parsed.fromModel ? " (model mode)" : "") + "\n" +
                "- Input: " + inputPath + "\n" +
                "- Output: " + outputPath + "\n" +
                (parsed.writeModel != null ? "- Model: " + Paths.get(parsed.writeModel).toAbsolutePath().normalize() + "\n" : "") +
                "- Function block: " + res.functionBlock.name + "\n" +
                "- Methods: " + res.functionBlock.methods.size() + "\n" +
                "- Properties: " + res.functionBlock.properties.size() + "\n" +
                "- Warnings: " + res.warnings.size()
        );
        return 0;
    }

    private static StToPlcOpenXmlOptions toCoreOptions(CliArgs parsed) {
        StToPlcOpenXmlOptions o = new StToPlcOpenXmlOptions();
        if (parsed.author != null) o.author = parsed.author;
        if (parsed.company != null) o.companyName = parsed.company;
        if (parsed.productName != null) o.productName = parsed.productName;
        if (parsed.productVersion != null) o.productVersion = parsed.productVersion;
        o.timestamp = parsed.timestamp;
        o.seed = parsed.seed;
        return o;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String output;

        // document header
        String author;
        String company;
        String productName;
        String productVersion;
        LocalDateTime timestamp;

        // reproducible object ids
        Long seed;

        // JSON model snapshot
        String writeModel;
        boolean fromModel = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--author":
                        out.author = requireValue(args, ++i, "--author");
                        break;
                    case "--company":
                        out.company = requireValue(args, ++i, "--company");
                        break;
                    case "--product-name":
                        out.productName = requireValue(args, ++i, "--product-name");
                        break;
                    case "--product-version":
                        out.productVersion = requireValue(args, ++i, "--product-version");
                        break;
                    case "--timestamp":
                        out.timestamp = parseTimestamp(requireValue(args, ++i, "--timestamp"));
                        break;
                    case "--seed":
                        out.seed = parseLong(requireValue(args, ++i, "--seed"), "--seed");
                        break;
                    case "--write-model":
                        out.writeModel = requireValue(args, ++i, "--write-model");
                        break;
                    case "--from-model":
                        out.fromModel = true;
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        if (out.input == null) {
                            out.input = a;
                        } else if (out.output == null) {
                            out.output = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static LocalDateTime parseTimestamp(String v) {
            try {
                return LocalDateTime.parse(v.trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid value for --timestamp (expected e.g. 2024-05-01T08:30:00): " + v);
            }
        }

        static long parseLong(String v, String flag) {
            try {
                return Long.parseLong(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v);
            }
        }

        static void printHelp() {
            System.out.println(
                    "st-to-plcopenxml\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar st-to-plcopenxml.jar <input.st> <output.xml> [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --author <name>            Author written to the content header (default: empty)\n" +
                    "  --company <name>           Company written to the file header (default: empty)\n" +
                    "  --product-name <name>      Product name in the file header\n" +
                    "                             (default: Machine Expert Logic Builder)\n" +
                    "  --product-version <ver>    Product version in the file header (default: V22.1.1.0)\n" +
                    "  --timestamp <date-time>    Creation/modification time, ISO local date-time\n" +
                    "                             (default: now)\n" +
                    "  --seed <long>              Seed object ids so repeated runs give identical output\n" +
                    "  --write-model <file.json>  Also write the extracted model as JSON\n" +
                    "  --from-model               Treat <input> as a model JSON written by --write-model\n" +
                    "  -h, --help                 Show help\n" +
                    "\n" +
                    "Exit codes:\n" +
                    "  0 success, 1 usage error or missing input, 2 conversion or write failure\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar st-to-plcopenxml-cli/target/st-to-plcopenxml.jar samples/logger/Logger.st out/Logger.xml\n" +
                    "  java -jar st-to-plcopenxml-cli/target/st-to-plcopenxml.jar Logger.st Logger.xml --seed 1 --timestamp 2024-05-01T08:30:00\n"
            );
        }
    }
}
