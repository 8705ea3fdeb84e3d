package com.kotsin.portfolio.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kotsin.portfolio.error.PortfolioFetchException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Client for the Investing.com mobile API ({@code aappapi.investing.com}).
 *
 * <p>Requests are synchronous OkHttp calls; the call timeout configured on the
 * shared {@link OkHttpClient} bounds every wait. Errors are classified here so
 * callers only ever see a {@link PortfolioFetchException}.
 */
@Slf4j
public class InvestingComProvider implements PortfolioProvider {

    static final String X_APP_VER = "1408";
    static final String X_META_VER = "14";
    static final String INTERNAL_VERSION = "1293";
    static final String USER_AGENT = "Dalvik/2.1.0 (Linux; U; Android 10; Pixel 3 Build/QQ1D.200105.002)";

    static final String ERROR_TOKEN_EXPIRED = "1001";
    static final String ERROR_INVALID_PORTFOLIO = "203";

    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String udid;

    public InvestingComProvider(OkHttpClient http, ObjectMapper mapper, HttpUrl baseUrl, String udid) {
        this.http = http;
        this.mapper = mapper;
        this.baseUrl = baseUrl;
        this.udid = udid;
    }

    // ---------------------------------------------------------------------
    // Login
    // ---------------------------------------------------------------------
    @Override
    public String authenticate(String email, String password) {
        ObjectNode query = mapper.createObjectNode().put("action", "login");
        HttpUrl url = apiUrl("login_api.php")
                .addQueryParameter("data", compact(query))
                .build();

        FormBody body = new FormBody.Builder()
                .add("internal_version", INTERNAL_VERSION)
                .add("reg_initiator", "Side Menu Sign In")
                .add("email", email)
                .add("smssupport", "1")
                .add("password", md5Hex(password))
                .add("reg_source", "android")
                .build();

        Request req = new Request.Builder()
                .url(url)
                .header("x-udid", udid)
                .header("x-app-ver", X_APP_VER)
                .header("x-meta-ver", X_META_VER)
                .header("User-Agent", USER_AGENT)
                .post(body)
                .build();

        log.debug("Attempting login for {}", email);
        JsonNode root;
        try (Response res = http.newCall(req).execute()) {
            if (res.code() == 401 || res.code() == 403) {
                throw PortfolioFetchException.invalidCredentials("Login refused: HTTP " + res.code());
            }
            if (!res.isSuccessful()) {
                throw PortfolioFetchException.network("Login failed: HTTP " + res.code());
            }
            root = readBody(res);
        } catch (IOException e) {
            throw PortfolioFetchException.network("Login request failed: " + e.getMessage(), e);
        }

        JsonNode system = root.path("system");
        if ("error".equals(system.path("status").asText())) {
            String message = system.path("messages").path("display_message").asText("Unknown error");
            throw PortfolioFetchException.invalidCredentials(message);
        }
        JsonNode data = root.path("data");
        JsonNode errors = data.path("errors");
        if (errors.isArray()) {
            String message = errors.size() > 0
                    ? errors.get(0).path("fieldError").asText("Login failed")
                    : "Login failed";
            throw PortfolioFetchException.invalidCredentials(message);
        }
        String token = data.path("token").asText(null);
        if (token == null || token.isBlank()) {
            throw PortfolioFetchException.decode("No token in login response");
        }
        log.info("Login accepted for user {}", data.path("user_email").asText(email));
        return token;
    }

    // ---------------------------------------------------------------------
    // Portfolio list
    // ---------------------------------------------------------------------
    @Override
    public List<PortfolioInfo> listPortfolios(String token) {
        ArrayNode query = mapper.createArrayNode();
        query.addObject()
                .put("action", "get_all_portfolios_new")
                .put("bring_sums", false)
                .put("include_pair_attr", false)
                .put("include_pairs", true);

        log.debug("Fetching portfolio list");
        JsonNode root = getPortfolioApi(token, compact(query), null);

        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull() || (data.isArray() && data.isEmpty())) {
            return List.of();
        }
        if (!data.isArray()) {
            throw PortfolioFetchException.decode("Portfolio list: 'data' is not an array");
        }
        JsonNode portfolios = data.get(0).path("screen_data").path("portfolio");
        if (portfolios.isMissingNode()) {
            return List.of();
        }
        if (!portfolios.isArray()) {
            throw PortfolioFetchException.decode("Portfolio list: 'portfolio' is not an array");
        }
        List<PortfolioInfo> result = new ArrayList<>();
        for (JsonNode p : portfolios) {
            result.add(new PortfolioInfo(
                    p.path("portfolio_id").asText(),
                    p.path("portfolio_name").asText(),
                    p.path("portfolioType").asText()));
        }
        return result;
    }

    // ---------------------------------------------------------------------
    // Positions
    // ---------------------------------------------------------------------
    @Override
    public List<Position> getPositions(String token, String portfolioId) {
        ObjectNode query = mapper.createObjectNode()
                .put("action", "get_portfolio_positions")
                .put("bring_sums", false)
                .put("include_pair_attr", false)
                .put("pair_id", 0);
        if (portfolioId.chars().allMatch(Character::isDigit) && !portfolioId.isEmpty()) {
            query.put("portfolioid", Long.parseLong(portfolioId));
        } else {
            query.put("portfolioid", portfolioId);
        }
        query.put("positionType", "summary");

        log.debug("Fetching positions for portfolio {}", portfolioId);
        JsonNode root = getPortfolioApi(token, compact(query), portfolioId);

        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw PortfolioFetchException.decode("No data in positions response for " + portfolioId);
        }
        JsonNode screen = data.get(0).path("screen_data");
        if (!screen.isObject() || screen.isEmpty()) {
            throw PortfolioFetchException.decode("Missing screen_data for portfolio " + portfolioId);
        }

        JsonNode rows = screen.path("positionsData");
        List<Position> positions = new ArrayList<>();
        if (rows.isArray()) {
            for (JsonNode row : rows) {
                positions.add(toPosition(row, row.path("pair_name").asText("")));
            }
        } else {
            // summary screens carry the portfolio totals as one aggregate row
            positions.add(toPosition(screen, "summary"));
        }
        return positions;
    }

    // ---------------------------------------------------------------------
    // helpers
    // ---------------------------------------------------------------------
    private JsonNode getPortfolioApi(String token, String data, String portfolioId) {
        HttpUrl url = apiUrl("portfolio_api.php")
                .addQueryParameter("data", data)
                .build();
        Request req = new Request.Builder()
                .url(url)
                .header("x-token", token)
                .header("x-udid", udid)
                .header("x-app-ver", X_APP_VER)
                .header("x-meta-ver", X_META_VER)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .get()
                .build();

        JsonNode root;
        try (Response res = http.newCall(req).execute()) {
            if (res.code() == 401) {
                throw PortfolioFetchException.authExpired("HTTP 401 from portfolio API");
            }
            if (!res.isSuccessful()) {
                throw PortfolioFetchException.network("Portfolio API HTTP " + res.code());
            }
            root = readBody(res);
        } catch (IOException e) {
            throw PortfolioFetchException.network("Portfolio API request failed: " + e.getMessage(), e);
        }

        JsonNode system = root.path("system");
        if ("failed".equals(system.path("status").asText())) {
            String code = system.path("message_error_code").asText("unknown");
            if (ERROR_TOKEN_EXPIRED.equals(code)) {
                throw PortfolioFetchException.authExpired("Token expired or invalid");
            }
            if (ERROR_INVALID_PORTFOLIO.equals(code) && portfolioId != null) {
                throw PortfolioFetchException.portfolioNotFound(portfolioId);
            }
            throw PortfolioFetchException.network("Portfolio API error code " + code);
        }
        return root;
    }

    private Position toPosition(JsonNode row, String name) {
        return new Position(
                name,
                amount(row.path("MarketValue")),
                amount(row.path("OpenPL")),
                amount(row.path("DailyPL")));
    }

    private static double amount(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        return EuropeanNumbers.parse(node.asText(""));
    }

    private JsonNode readBody(Response res) {
        try {
            String raw = res.body() != null ? res.body().string() : "";
            if (raw.isBlank()) {
                throw PortfolioFetchException.decode("Empty response body");
            }
            JsonNode root = mapper.readTree(raw);
            if (!root.isObject()) {
                throw PortfolioFetchException.decode("Response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw PortfolioFetchException.decode("Malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw PortfolioFetchException.network("Failed reading response: " + e.getMessage(), e);
        }
    }

    private HttpUrl.Builder apiUrl(String endpoint) {
        return baseUrl.newBuilder()
                .addPathSegment(endpoint)
                .addQueryParameter("time_utc_offset", "3600")
                .addQueryParameter("skinID", "2")
                .addQueryParameter("lang_ID", "4");
    }

    private String compact(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise query " + node, e);
        }
    }

    static String md5Hex(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
