package no.cantara.acdc;

import no.cantara.acdc.codec.SerializationKind;
import no.cantara.acdc.model.Container;
import no.cantara.acdc.said.DigestCode;
import no.cantara.acdc.said.SelfAddressing;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

/**
 * Command-line interface for creating and checking containers.
 * <pre>
 * Usage: java -jar acdc-parser.jar create &lt;issuer&gt; &lt;schema&gt; &lt;attributes.yaml&gt;
 *                                  [--registry ri] [--kind JSON|CBOR|MGPK] [--code E] [--out file]
 *        java -jar acdc-parser.jar verify &lt;file&gt;
 *        java -jar acdc-parser.jar show &lt;file&gt;
 * </pre>
 */
public class AcdcCli {

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: java -jar acdc-parser.jar create <issuer> <schema> <attributes.yaml>",
            "                                 [--registry ri] [--kind JSON|CBOR|MGPK] [--code E] [--out file]",
            "       java -jar acdc-parser.jar verify <file>",
            "       java -jar acdc-parser.jar show <file>");

    // YAML is a superset of JSON, so attribute files may be either
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1) {
            err.println(USAGE);
            return 1;
        }
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        try {
            return switch (args[0]) {
                case "create" -> create(rest, out, err);
                case "verify" -> verify(rest, out, err);
                case "show" -> show(rest, out, err);
                default -> {
                    err.println("Unknown command: " + args[0]);
                    err.println(USAGE);
                    yield 1;
                }
            };
        } catch (AcdcException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }

    private static int create(String[] args, PrintStream out, PrintStream err) throws IOException {
        String registry = "";
        SerializationKind kind = SerializationKind.JSON;
        DigestCode code = DigestCode.BLAKE3_256;
        Path outFile = null;
        String[] positional = new String[3];
        int count = 0;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--registry" -> registry = value(args, ++i);
                case "--kind" -> kind = SerializationKind.fromCode(value(args, ++i));
                case "--code" -> code = DigestCode.of(value(args, ++i));
                case "--out" -> outFile = Path.of(value(args, ++i));
                default -> {
                    if (count == positional.length) {
                        err.println("Unexpected argument: " + args[i]);
                        return 1;
                    }
                    positional[count++] = args[i];
                }
            }
        }
        if (count < positional.length) {
            err.println(USAGE);
            return 1;
        }

        Container container = Container.builder()
                .issuer(positional[0])
                .schema(positional[1])
                .registryIdentifier(registry)
                .attributes(loadMap(Path.of(positional[2])))
                .kind(kind)
                .digestCode(code)
                .build();
        byte[] bytes = container.serialize();
        if (outFile != null) {
            Files.write(outFile, bytes);
            out.println(container.digest());
        } else if (kind == SerializationKind.JSON) {
            out.println(new String(bytes, StandardCharsets.UTF_8));
        } else {
            err.println("Binary kind " + kind.code() + " needs --out");
            return 1;
        }
        return 0;
    }

    private static int verify(String[] args, PrintStream out, PrintStream err) throws IOException {
        Path path = existing(args, err);
        if (path == null) {
            return 1;
        }
        String said = SelfAddressing.verify(Files.readAllBytes(path));
        out.printf("✓ %s is intact, identifier %s%n", path, said);
        return 0;
    }

    private static int show(String[] args, PrintStream out, PrintStream err) throws IOException {
        Path path = existing(args, err);
        if (path == null) {
            return 1;
        }
        Container c = AcdcParser.parse(path);
        out.printf("version:  %s%n", c.version());
        out.printf("digest:   %s%n", c.digest());
        out.printf("issuer:   %s%n", c.issuer());
        out.printf("registry: %s%n", c.registryIdentifier());
        out.printf("schema:   %s%n", c.schema());
        out.printf("attrs:    %s%n", c.attributes() == null ? "-" : c.attributes().toWire());
        c.edgeRefs().forEach((label, ref) -> out.printf("edge:     %s -> %s (%s)%n",
                label, ref.target(), ref.effectiveOperator()));
        out.printf("intact:   %s%n", AcdcParser.verify(Files.readAllBytes(path)));
        return 0;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> loadMap(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            Object data = YAML.load(is);
            if (!(data instanceof Map<?, ?>)) {
                throw new AcdcException(AcdcException.Reason.INVALID_FIELD, path + " must contain a mapping");
            }
            return (Map<String, Object>) data;
        }
    }

    private static Path existing(String[] args, PrintStream err) {
        if (args.length != 1) {
            err.println(USAGE);
            return null;
        }
        Path path = Path.of(args[0]);
        if (!Files.exists(path)) {
            err.println("Error: file not found: " + path);
            return null;
        }
        return path;
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "missing value for " + args[i - 1]);
        }
        return args[i];
    }
}
