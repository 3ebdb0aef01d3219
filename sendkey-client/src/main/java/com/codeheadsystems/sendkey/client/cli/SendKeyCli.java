package com.codeheadsystems.sendkey.client.cli;

import com.codeheadsystems.sendkey.client.accessor.SendKeyAccessor;
import com.codeheadsystems.sendkey.client.manager.SendKeyClientManager;
import com.codeheadsystems.sendkey.client.model.ServerConnectionInfo;
import com.codeheadsystems.sendkey.client.session.SessionFileStore;
import com.codeheadsystems.sendkey.model.CreateEntryResponse;
import com.codeheadsystems.sendkey.model.CreateUserResponse;
import com.codeheadsystems.sendkey.model.EntryView;
import com.codeheadsystems.sendkey.model.LoginResponse;
import com.codeheadsystems.sendkey.model.RevealEntryResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Command-line client for a sendkey server.
 *
 * <pre>
 * Usage:
 *   SendKeyCli &lt;command&gt; [arguments] [options]
 *
 * Commands:
 *   create_user  &lt;email&gt; &lt;password&gt; [firstName] [lastName]
 *   login        &lt;email&gt; &lt;password&gt;
 *   logout
 *   create_entry &lt;name&gt; &lt;sendToEmail&gt; &lt;value&gt; &lt;secret&gt; &lt;durationMinutes&gt;
 *   list_entries
 *   find_entry   &lt;entryId&gt; &lt;nonce&gt;
 *   reveal_entry &lt;entryId&gt; &lt;nonce&gt; &lt;secret&gt;
 *
 * Options:
 *   --server &lt;url&gt;    Server base URL     (default: http://localhost:8080)
 *   --session &lt;file&gt;  Session file        (default: ~/.sendkey)
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 failure reported by the server or transport, 2 usage error.
 */
public class SendKeyCli {

  static final int OK = 0;
  static final int FAILURE = 1;
  static final int USAGE = 2;

  private static final String DEFAULT_SERVER = "http://localhost:8080";

  private final SendKeyClientManager manager;
  private final PrintStream out;
  private final PrintStream err;

  public SendKeyCli(SendKeyClientManager manager, PrintStream out, PrintStream err) {
    this.manager = manager;
    this.out = out;
    this.err = err;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    String server = DEFAULT_SERVER;
    Path sessionFile = SessionFileStore.defaultPath();
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--server", "--session" -> {
          if (i + 1 >= args.length) {
            printUsage(System.err);
            System.exit(USAGE);
          }
          if (args[i].equals("--server")) {
            server = args[++i];
          } else {
            sessionFile = Paths.get(args[++i]);
          }
        }
        default -> positional.add(args[i]);
      }
    }

    ObjectMapper objectMapper = SendKeyAccessor.defaultObjectMapper();
    SendKeyAccessor accessor = new SendKeyAccessor(HttpClient.newHttpClient(), objectMapper,
        new ServerConnectionInfo(URI.create(server)));
    SendKeyClientManager manager = new SendKeyClientManager(accessor,
        new SessionFileStore(sessionFile, objectMapper));
    System.exit(new SendKeyCli(manager, System.out, System.err).run(positional));
  }

  /**
   * Runs one command.
   *
   * @param positional the command followed by its arguments
   * @return the process exit code
   */
  public int run(List<String> positional) {
    if (positional.isEmpty()) {
      printUsage(err);
      return USAGE;
    }
    String command = positional.get(0);
    List<String> arguments = positional.subList(1, positional.size());
    try {
      return switch (command) {
        case "create_user" -> createUser(arguments);
        case "login" -> login(arguments);
        case "logout" -> logout(arguments);
        case "create_entry" -> createEntry(arguments);
        case "list_entries" -> listEntries(arguments);
        case "find_entry" -> findEntry(arguments);
        case "reveal_entry" -> revealEntry(arguments);
        default -> {
          err.println("Unknown command: " + command);
          printUsage(err);
          yield USAGE;
        }
      };
    } catch (UsageException e) {
      err.println(e.getMessage());
      printUsage(err);
      return USAGE;
    } catch (SecurityException e) {
      err.println("Authentication failed: " + e.getMessage());
      return FAILURE;
    } catch (RuntimeException e) {
      err.println("Error: " + e.getMessage());
      return FAILURE;
    }
  }

  // ── Commands ──────────────────────────────────────────────────────────────

  private int createUser(List<String> args) {
    requireArgs(args, 2, 4, "create_user <email> <password> [firstName] [lastName]");
    CreateUserResponse response = manager.createUser(args.get(0), args.get(1),
        args.size() > 2 ? args.get(2) : null, args.size() > 3 ? args.get(3) : null);
    if (!response.success()) {
      return errors(response.errors());
    }
    out.println("Created user " + response.user().id() + " (" + response.user().email() + ")");
    return OK;
  }

  private int login(List<String> args) {
    requireArgs(args, 2, 2, "login <email> <password>");
    LoginResponse response = manager.login(args.get(0), args.get(1));
    if (!response.success()) {
      return errors(response.errors());
    }
    out.println("Logged in as " + response.user().email());
    return OK;
  }

  private int logout(List<String> args) {
    requireArgs(args, 0, 0, "logout");
    manager.logout();
    out.println("Logged out");
    return OK;
  }

  private int createEntry(List<String> args) {
    requireArgs(args, 5, 5, "create_entry <name> <sendToEmail> <value> <secret> <durationMinutes>");
    long durationMinutes;
    try {
      durationMinutes = Long.parseLong(args.get(4));
    } catch (NumberFormatException e) {
      throw new UsageException("durationMinutes must be a whole number: " + args.get(4));
    }
    CreateEntryResponse response = manager.createEntry(args.get(0), args.get(1), args.get(2), args.get(3),
        durationMinutes);
    if (!response.success()) {
      return errors(response.errors());
    }
    out.println("Created entry " + response.entry().id() + ", expires " + response.entry().expiresAtUtc());
    return OK;
  }

  private int listEntries(List<String> args) {
    requireArgs(args, 0, 0, "list_entries");
    List<EntryView> entries = manager.listEntries();
    if (entries.isEmpty()) {
      out.println("No active entries");
    }
    for (EntryView entry : entries) {
      out.println(entry.id() + "  " + entry.name() + "  to " + entry.sentToEmail()
          + "  expires " + entry.expiresAtUtc());
    }
    return OK;
  }

  private int findEntry(List<String> args) {
    requireArgs(args, 2, 2, "find_entry <entryId> <nonce>");
    Optional<EntryView> entry = manager.findEntry(parseId(args.get(0)), args.get(1));
    if (entry.isEmpty()) {
      err.println("Entry not found");
      return FAILURE;
    }
    out.println(entry.get().name() + " from " + entry.get().sentByUserId()
        + ", expires " + entry.get().expiresAtUtc());
    return OK;
  }

  private int revealEntry(List<String> args) {
    requireArgs(args, 3, 3, "reveal_entry <entryId> <nonce> <secret>");
    RevealEntryResponse response = manager.revealEntry(parseId(args.get(0)), args.get(1), args.get(2));
    if (!response.success()) {
      int code = errors(response.errors());
      if (Boolean.TRUE.equals(response.expired())) {
        err.println("The entry has expired and can no longer be revealed");
      }
      return code;
    }
    out.println(response.value());
    return OK;
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private int errors(List<String> errors) {
    errors.forEach(err::println);
    return FAILURE;
  }

  private static void requireArgs(List<String> args, int min, int max, String usage) {
    if (args.size() < min || args.size() > max) {
      throw new UsageException("Usage: SendKeyCli " + usage);
    }
  }

  private static UUID parseId(String id) {
    try {
      return UUID.fromString(id);
    } catch (IllegalArgumentException e) {
      throw new UsageException("Not an entry id: " + id);
    }
  }

  private static void printUsage(PrintStream stream) {
    stream.println("Usage: SendKeyCli <command> [arguments] [options]");
    stream.println();
    stream.println("Commands:");
    stream.println("  create_user  <email> <password> [firstName] [lastName]");
    stream.println("  login        <email> <password>");
    stream.println("  logout");
    stream.println("  create_entry <name> <sendToEmail> <value> <secret> <durationMinutes>");
    stream.println("  list_entries");
    stream.println("  find_entry   <entryId> <nonce>");
    stream.println("  reveal_entry <entryId> <nonce> <secret>");
    stream.println();
    stream.println("Options:");
    stream.println("  --server <url>     Server base URL  (default: " + DEFAULT_SERVER + ")");
    stream.println("  --session <file>   Session file     (default: ~/.sendkey)");
  }

  private static class UsageException extends RuntimeException {
    UsageException(String message) {
      super(message);
    }
  }
}
