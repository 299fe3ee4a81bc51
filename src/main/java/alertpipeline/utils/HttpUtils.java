package alertpipeline.utils;

import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.collections4.MapUtils;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class HttpUtils {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private static final OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .build();

    private HttpUtils() {
    }

    public static String get(String url, Map<String, String> headers, Duration timeout) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .get();
        return execute(builder, headers, timeout);
    }

    public static String post(String url, Map<String, String> headers, String jsonBody, Duration timeout) throws IOException {
        return send("POST", url, headers, jsonBody, timeout);
    }

    public static String put(String url, Map<String, String> headers, String jsonBody, Duration timeout) throws IOException {
        return send("PUT", url, headers, jsonBody, timeout);
    }

    /**
     * 发送带 JSON 请求体的请求, 非 2xx 响应抛出 IOException
     */
    public static String send(String method, String url, Map<String, String> headers, String jsonBody,
                              Duration timeout) throws IOException {
        RequestBody body = RequestBody.create(jsonBody, JSON);
        Request.Builder builder = new Request.Builder()
                .url(url)
                .method(method.toUpperCase(), body);
        return execute(builder, headers, timeout);
    }

    private static String execute(Request.Builder builder, Map<String, String> headers, Duration timeout) throws IOException {
        if (MapUtils.isNotEmpty(headers)) {
            builder.headers(Headers.of(headers));
        }
        OkHttpClient callClient = timeout == null
                ? client
                : client.newBuilder().callTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).build();
        try (Response response = callClient.newCall(builder.build()).execute()) {
            ResponseBody responseBody = response.body();
            String result = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new IOException(String.format("Unexpected code %d, body=%s", response.code(), result));
            }
            return result;
        }
    }
}
