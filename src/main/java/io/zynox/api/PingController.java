package io.zynox.api;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Unauthenticated liveness check and landing page.
 */
@RestController
public class PingController {

    private static final String LANDING_PAGE = """
            <html>
                <head><title>Zynox Cloud Storage</title></head>
                <body style="font-family: Arial; background-color:#f4f4f4; text-align:center; padding:50px;">
                    <h1 style="color:#2E86C1;">Zynox Cloud Storage</h1>
                    <p>Encrypted memory storage for <b>Zynox AGI</b>.</p>
                    <ul style="text-align:left; display:inline-block;">
                        <li>Memories encrypted at rest with AES-GCM</li>
                        <li>SQLite storage with a per-record version field</li>
                        <li>Endpoints: <code>/v1/save</code>, <code>/v1/list</code>, <code>/v1/download</code>,
                            <code>/v1/delete</code>, <code>/v1/query</code></li>
                        <li>Automatic emotion tags (happy/sad/angry) from memory text</li>
                        <li>Protected by an <code>X-API-Key</code> header</li>
                    </ul>
                </body>
            </html>
            """;

    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok", "message", "Zynox Cloud is alive"));
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
    public ResponseEntity<String> landingPage() {
        return ResponseEntity.ok(LANDING_PAGE);
    }
}
