package com.toolguard.audit;

import com.toolguard.observability.ToolguardMetrics;
import com.toolguard.regex.SafeRegexEvaluator;
import com.toolguard.regex.SafeRegexEvaluator.Outcome;
import com.toolguard.tool.ToolCallText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Flags tool calls that can reach the network, lists their destinations and
 * looks for shapes that push local data outward.
 * <p>
 * Every pattern of one audit shares a match deadline. Past it the call is
 * treated as a network request and as exfiltration.
 */
@Component
public class NetworkAuditor {

    private static final Logger log = LoggerFactory.getLogger(NetworkAuditor.class);

    // bash /dev/tcp redirection opens a socket without any of the named tools
    private static final Pattern NETWORK_TOOL = Pattern.compile(
            "\\b(curl|wget|fetch|web_fetch|http_request|ssh|scp|sftp|ftp|rsync|nc|ncat|netcat|telnet|socat)\\b"
                    + "|/dev/(tcp|udp)/",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern URL = Pattern.compile(
            "(?:https?|ftp|wss?)://[^\\s'\"<>|;,)]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern HOST_PORT = Pattern.compile(
            "\\b(?:nc|ncat|netcat|telnet|socat)\\s+(?:-[a-zA-Z]+\\s+)*([A-Za-z0-9.\\-]+)\\s+(\\d{1,5})\\b",
            Pattern.CASE_INSENSITIVE);

    // first match wins; flags are case-sensitive (curl -F uploads, -f does not)
    private static final List<Pattern> EXFILTRATION_PATTERNS = List.of(
            Pattern.compile("\\b(cat|tar|zip|gzip|base64|xxd|head|tail|less|more|find|grep)\\b[^|]*\\|\\s*(curl|wget|nc|ncat|netcat|socat)\\b"),
            Pattern.compile("\\bcurl\\b.*\\s(-[dFT]|--data(-\\w+)?|--form|--upload-file)(?![\\w-])"),
            Pattern.compile("\\bwget\\b.*\\s--post-(data|file)\\b"),
            Pattern.compile("/dev/(tcp|udp)/"),
            Pattern.compile("\\b(scp|rsync)\\b.*\\s([\\w.\\-]+@)?[\\w.\\-]+:\\S*\\s*$")
    );

    private final ToolCallText toolCallText;
    private final SafeRegexEvaluator regexEvaluator;
    private final ToolguardMetrics metrics;

    public NetworkAuditor(ToolCallText toolCallText, SafeRegexEvaluator regexEvaluator, ToolguardMetrics metrics) {
        this.toolCallText = toolCallText;
        this.regexEvaluator = regexEvaluator;
        this.metrics = metrics;
    }

    public NetworkAuditResult audit(String toolName, Map<String, ?> args) {
        String searchString = toolCallText.buildSearchString(toolName, args);
        CharSequence guarded = regexEvaluator.withDeadline(searchString);
        if (regexEvaluator.find(NETWORK_TOOL, guarded) == Outcome.NO_MATCH) {
            return NetworkAuditResult.none();
        }

        List<String> targets = extractTargets(guarded);
        boolean allLocal = !targets.isEmpty() && targets.stream().allMatch(NetworkAuditor::isLocalTarget);

        String reason = null;
        for (Pattern pattern : EXFILTRATION_PATTERNS) {
            if (regexEvaluator.find(pattern, guarded) != Outcome.NO_MATCH) {
                reason = pattern.pattern();
                break;
            }
        }

        NetworkAuditResult result = new NetworkAuditResult(true, targets, reason != null, reason, allLocal);
        metrics.recordNetworkAudit(result.verdict());
        if (result.isExfiltration()) {
            log.warn("Possible exfiltration by tool {} to {}", toolName, targets);
        } else {
            log.debug("Network request by tool {} to {} (local={})", toolName, targets, allLocal);
        }
        return result;
    }

    private List<String> extractTargets(CharSequence searchString) {
        Set<String> targets = new LinkedHashSet<>();
        regexEvaluator.forEachMatch(URL, searchString, match -> targets.add(match.group()));
        regexEvaluator.forEachMatch(HOST_PORT, searchString,
                match -> targets.add(match.group(1) + ":" + match.group(2)));
        return new ArrayList<>(targets);
    }

    static boolean isLocalTarget(String target) {
        String host = hostOf(target);
        if (host == null || host.isEmpty()) return false;
        host = host.toLowerCase(Locale.ROOT);
        return host.equals("localhost")
                || host.endsWith(".localhost")
                || host.startsWith("127.")
                || host.equals("::1")
                || host.equals("[::1]")
                || host.equals("0.0.0.0");
    }

    private static String hostOf(String target) {
        if (target.contains("://")) {
            try {
                String host = URI.create(target).getHost();
                if (host != null) return host;
            } catch (IllegalArgumentException e) {
                log.debug("Unparseable URL target {}, falling back to manual host extraction", target);
            }
            String rest = target.substring(target.indexOf("://") + 3);
            int slash = rest.indexOf('/');
            if (slash >= 0) rest = rest.substring(0, slash);
            int at = rest.lastIndexOf('@');
            if (at >= 0) rest = rest.substring(at + 1);
            return stripPort(rest);
        }
        return stripPort(target);
    }

    private static String stripPort(String hostAndPort) {
        if (hostAndPort.startsWith("[")) {
            int close = hostAndPort.indexOf(']');
            return close > 0 ? hostAndPort.substring(0, close + 1) : hostAndPort;
        }
        int colon = hostAndPort.lastIndexOf(':');
        return colon >= 0 ? hostAndPort.substring(0, colon) : hostAndPort;
    }
}
