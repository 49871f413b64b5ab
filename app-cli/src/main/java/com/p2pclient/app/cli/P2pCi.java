package com.p2pclient.app.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.p2pclient.app.logging.LogSetup;
import com.p2pclient.core.content.P2PClient;
import com.p2pclient.core.error.P2PException;
import com.p2pclient.core.model.ConnectionConfig;
import com.p2pclient.core.util.JsonSupport;
import com.p2pclient.core.util.P2PConfigLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import java.util.logging.Level;

/**
 * 콘텐츠 아이템 콘솔 도구.
 *
 * <pre>
 * p2pci get chi-na-lorem-a -f title
 * p2pci save chi-na-lorem-a -F body.html -t "Lorem" -s working
 * p2pci mv chi-na-lorem-a --new-slug chi-na-lorem-b
 * </pre>
 *
 * 연결 설정은 --config(YAML) 또는 환경 변수(P2P_API_URL, P2P_API_KEY).
 */
@Command(name = "p2pci",
        mixinStandardHelpOptions = true,
        version = "p2pci 1.5.0",
        description = "Get, save or rename P2P content items",
        subcommands = {P2pCi.GetCommand.class,
                P2pCi.SaveCommand.class,
                P2pCi.MvCommand.class})
public class P2pCi implements Runnable {

    /** 분류된 P2P 오류로 끝났을 때 종료 코드 */
    static final int EXIT_P2P_ERROR = 2;
    /** 설정/입력 오류 */
    static final int EXIT_USAGE = 1;

    @CommandLine.Spec
    CommandSpec commandSpec;

    @Option(names = {"--config"}, description = "Path to p2p.yml (defaults to environment variables)")
    Path configPath;

    @Option(names = {"-v", "--verbose"}, description = "Log every request attempt")
    boolean verbose;

    private final Supplier<P2PClient> clientOverride;
    private final Map<String, String> env;

    public P2pCi() {
        this(null, System.getenv());
    }

    /** 테스트용: 클라이언트/환경 주입 */
    P2pCi(Supplier<P2PClient> clientOverride, Map<String, String> env) {
        this.clientOverride = clientOverride;
        this.env = env;
    }

    public static void main(String[] args) {
        LogSetup.init();
        int exitCode = new CommandLine(new P2pCi()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        commandSpec.commandLine().usage(out());
    }

    P2PClient client() throws IOException {
        if (clientOverride != null) return clientOverride.get();
        ConnectionConfig cfg = (configPath != null)
                ? P2PConfigLoader.load(configPath)
                : P2PConfigLoader.fromEnvironment(env);
        if (verbose) {
            LogSetup.setLevel(Level.INFO);
            cfg = cfg.toBuilder().debug(true).build();
        }
        return new P2PClient(cfg);
    }

    PrintWriter out() { return commandSpec.commandLine().getOut(); }

    PrintWriter err() { return commandSpec.commandLine().getErr(); }

    /** 공통 실행: 분류된 오류는 kind/status/body 를 찍고 0 이 아닌 코드로 끝낸다. */
    int run(ClientAction action) {
        try {
            action.apply(client());
            out().flush();
            return 0;
        } catch (P2PException e) {
            err().println(e.getMessage());
            err().println("kind=" + e.getKind() + " status=" + e.getStatusCode());
            if (!e.getBody().isBlank()) err().println(e.getBody());
            err().flush();
            return EXIT_P2P_ERROR;
        } catch (IOException | IllegalArgumentException e) {
            err().println("p2pci: " + e.getMessage());
            err().flush();
            return EXIT_USAGE;
        }
    }

    @FunctionalInterface
    interface ClientAction {
        void apply(P2PClient client) throws IOException;
    }

    // ===== Subcommands =====
    @Command(name = "get", description = "Print a content item (or one of its fields)")
    static class GetCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private P2pCi parent;

        @Parameters(index = "0", description = "Slug of the content item")
        private String slug;

        @Option(names = {"-f", "--field-name"}, description = "Field to output")
        private String fieldName;

        @Override
        public Integer call() {
            return parent.run(client -> {
                JsonNode item = client.getContentItem(slug, null, false);
                JsonNode field = (fieldName == null) ? null : item.get(fieldName);
                if (field == null) {
                    parent.out().println(JsonSupport.write(item));
                } else {
                    parent.out().println(field.isTextual() ? field.textValue() : JsonSupport.write(field));
                }
            });
        }
    }

    @Command(name = "save", description = "Create or update a content item")
    static class SaveCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private P2pCi parent;

        @Parameters(index = "0", description = "Slug of the content item")
        private String slug;

        @Option(names = {"-F", "--from-file"}, description = "Load the body from a file ('-' for stdin)", defaultValue = "-")
        private String bodyFile;

        @Option(names = {"-c", "--type-code"}, description = "Content item type", defaultValue = "blurb")
        private String type;

        @Option(names = {"-t", "--title"}, description = "Content item title")
        private String title;

        @Option(names = {"-s", "--state"}, description = "Content item state: ${COMPLETION-CANDIDATES}")
        private State state;

        @Override
        public Integer call() {
            return parent.run(client -> {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("slug", slug);
                item.put("content_item_type_code", type);
                item.put("body", readBody(bodyFile));
                if (state != null) item.put("content_item_state_code", state.name());
                if (title != null) item.put("title", title);

                parent.out().println("Saving '" + slug + "'");
                P2PClient.CreateOrUpdateResult r = client.createOrUpdateContentItem(item);
                parent.out().println((r.created() ? "Created '" : "Updated '") + slug + "'");
            });
        }

        private static String readBody(String file) throws IOException {
            if (file == null || file.equals("-")) {
                InputStream in = System.in;
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            return Files.readString(Path.of(file), StandardCharsets.UTF_8);
        }
    }

    /** 서비스가 받는 상태 코드 */
    enum State { live, working, archived, pending, junk }

    @Command(name = "mv", description = "Change the slug of a content item")
    static class MvCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private P2pCi parent;

        @Parameters(index = "0", description = "Current slug")
        private String slug;

        @Option(names = {"--new-slug"}, description = "New slug", required = true)
        private String newSlug;

        @Override
        public Integer call() {
            return parent.run(client -> {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("slug", newSlug);
                client.updateContentItem(item, slug);
                parent.out().println("Moved '" + slug + "' to '" + newSlug + "'");
            });
        }
    }
}
