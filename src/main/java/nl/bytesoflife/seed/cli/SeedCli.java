package nl.bytesoflife.seed.cli;

import nl.bytesoflife.seed.ast.Ast;
import nl.bytesoflife.seed.lexer.SourceException;
import nl.bytesoflife.seed.parser.SExpressionParser;
import nl.bytesoflife.seed.render.GraphRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Command-line entry point: {@code seed <file>} prints the file's forms as a Graphviz digraph.
 * <p>
 * This is the only place that turns failures into diagnostics and exit codes.
 * The graph is written to standard output only after the whole file parsed.
 */
public class SeedCli {

    private static final Logger log = LoggerFactory.getLogger(SeedCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private final SExpressionParser parser = new SExpressionParser();
    private final GraphRenderer renderer = new GraphRenderer();

    public int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            err.println("usage: seed <file>");
            return EXIT_USAGE;
        }

        String fileName = args[0];
        Path path = Path.of(fileName);

        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return fail(err, "file `" + fileName + "` does not exist.");
        } catch (IOException e) {
            log.debug("Failed to read {}", path, e);
            return fail(err, "file `" + fileName + "` could not be read: " + e.getMessage() + ".");
        }
        log.debug("Read {} bytes from {}", content.length, path);

        String graph;
        try {
            long startTime = System.currentTimeMillis();
            Ast ast = parser.parse(content);
            graph = renderer.render(ast);
            log.debug("Rendered {} clusters, {} chars in {}ms",
                    ast.roots().size(), graph.length(), System.currentTimeMillis() - startTime);
        } catch (SourceException e) {
            return fail(err, e.getDiagnostic() + ".");
        }

        out.print(graph);
        out.flush();
        return EXIT_OK;
    }

    private int fail(PrintStream err, String message) {
        log.debug("Aborting: {}", message);
        err.println("error: " + message);
        return EXIT_ERROR;
    }

    public static void main(String[] args) {
        Locale.setDefault(Locale.US);

        PrintStream out = new PrintStream(System.out, false, StandardCharsets.UTF_8);
        int status = new SeedCli().run(args, out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }
}
