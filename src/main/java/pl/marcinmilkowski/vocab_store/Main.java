package pl.marcinmilkowski.vocab_store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_store.attrs.DefaultLexAttrs;
import pl.marcinmilkowski.vocab_store.config.VocabConfig;
import pl.marcinmilkowski.vocab_store.config.VocabConfigLoader;
import pl.marcinmilkowski.vocab_store.lexicon.Flags;
import pl.marcinmilkowski.vocab_store.lexicon.Lexeme;
import pl.marcinmilkowski.vocab_store.lexicon.Vocab;
import pl.marcinmilkowski.vocab_store.lexicon.VocabStore;
import pl.marcinmilkowski.vocab_store.strings.InMemoryStringStore;
import pl.marcinmilkowski.vocab_store.strings.StringStore;
import pl.marcinmilkowski.vocab_store.vectors.LegacyVectorConverter;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point.
 *
 * Commands:
 *   init --vectors vectors.txt --output data/vocab/ [--config vocab.json]
 *   convert-vectors --input vectors.txt.gz --output vec.bin
 *   info --vocab data/vocab/
 *   lookup --vocab data/vocab/ --word theory
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        int status = 0;
        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "init":
                    status = handleInitCommand(args);
                    break;
                case "convert-vectors":
                    status = handleConvertCommand(args);
                    break;
                case "info":
                    status = handleInfoCommand(args);
                    break;
                case "lookup":
                    status = handleLookupCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
                    status = 2;
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
            status = 1;
        }
        if (status != 0) {
            System.exit(status);
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar vocab-store.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  init --vectors <vectors.txt> --output <vocab-dir> [--config <vocab.json>]");
        System.out.println("      Build a vocab from text word vectors and save it");
        System.out.println();
        System.out.println("  convert-vectors --input <vectors.txt[.gz]> --output <vec.bin>");
        System.out.println("      Convert text vectors to the binary vec.bin format");
        System.out.println();
        System.out.println("  info --vocab <vocab-dir>");
        System.out.println("      Print lexeme count, string count and vector dimension");
        System.out.println();
        System.out.println("  lookup --vocab <vocab-dir> --word <word>");
        System.out.println("      Print the cached attributes of one word");
    }

    private static int handleInitCommand(String[] args) throws IOException {
        String vectorsPath = null;
        String outputPath = null;
        String configPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--vectors":
                case "-v":
                    vectorsPath = args[++i];
                    break;
                case "--output":
                case "-o":
                    outputPath = args[++i];
                    break;
                case "--config":
                case "-c":
                    configPath = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (vectorsPath == null || outputPath == null) {
            System.err.println("Error: --vectors and --output are required");
            return 2;
        }

        VocabConfig config = configPath != null
            ? VocabConfigLoader.load(Paths.get(configPath))
            : VocabConfigLoader.loadDefaults();

        Vocab vocab = new Vocab(new InMemoryStringStore(), config);
        DefaultLexAttrs.install(vocab);
        int dim = vocab.loadVectors(Paths.get(vectorsPath));
        VocabStore.save(vocab, Paths.get(outputPath));

        System.out.println("Lexemes: " + vocab.size());
        System.out.println("Vector dimension: " + dim);
        System.out.println("Saved to: " + outputPath);
        return 0;
    }

    private static int handleConvertCommand(String[] args) throws IOException {
        String input = null;
        String output = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    input = args[++i];
                    break;
                case "--output":
                case "-o":
                    output = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (input == null || output == null) {
            System.err.println("Error: --input and --output are required");
            return 2;
        }

        long count = LegacyVectorConverter.convert(Paths.get(input), Paths.get(output));
        System.out.println("Converted " + count + " vectors to " + output);
        return 0;
    }

    private static int handleInfoCommand(String[] args) throws IOException {
        Path dir = parseVocabDir(args);
        if (dir == null) {
            System.err.println("Error: --vocab is required");
            return 2;
        }

        Vocab vocab = VocabStore.load(dir);
        System.out.println("Vocab: " + dir);
        System.out.println("Lexemes: " + vocab.size());
        System.out.println("Strings: " + vocab.strings().size());
        System.out.println("Vector dimension: " + vocab.vectorsLength());
        return 0;
    }

    private static int handleLookupCommand(String[] args) throws IOException {
        Path dir = parseVocabDir(args);
        String word = null;
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--word") || args[i].equals("-w")) {
                word = args[++i];
            }
        }
        if (dir == null || word == null) {
            System.err.println("Error: --vocab and --word are required");
            return 2;
        }

        Vocab vocab = VocabStore.load(dir);
        if (!vocab.contains(word)) {
            System.out.println("Not in vocab: " + word);
            return 1;
        }

        Lexeme lex = vocab.get(word);
        StringStore strings = vocab.strings();
        System.out.printf("%s: orth=%d, id=%d, length=%d, prob=%.4f%n",
            word, lex.orth(), lex.id(), lex.length(), lex.prob());
        System.out.printf("  lower=%s, norm=%s, shape=%s, prefix=%s, suffix=%s%n",
            strings.stringFor(lex.lower()), strings.stringFor(lex.norm()), strings.stringFor(lex.shape()),
            strings.stringFor(lex.prefix()), strings.stringFor(lex.suffix()));
        System.out.printf("  alpha=%b, digit=%b, punct=%b, like_num=%b%n",
            lex.checkFlag(Flags.IS_ALPHA), lex.checkFlag(Flags.IS_DIGIT),
            lex.checkFlag(Flags.IS_PUNCT), lex.checkFlag(Flags.LIKE_NUM));
        System.out.printf("  has_vector=%b, l2_norm=%.4f%n", vocab.hasVector(lex), lex.l2Norm());
        return 0;
    }

    private static Path parseVocabDir(String[] args) {
        for (int i = 1; i < args.length - 1; i++) {
            if (args[i].equals("--vocab") || args[i].equals("-d")) {
                return Paths.get(args[i + 1]);
            }
        }
        return null;
    }
}
