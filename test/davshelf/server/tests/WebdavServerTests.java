package davshelf.server.tests;

import davshelf.server.util.Args;
import davshelf.server.util.Logging;
import davshelf.server.webdav.WebdavConfig;
import davshelf.server.webdav.WebdavDelegate;
import davshelf.server.webdav.WebdavServer;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.StringRequestContent;
import org.junit.*;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.junit.Assert.*;

public class WebdavServerTests {
    private static final Logger LOG = Logging.LOG();

    private static final String LOCK_BODY = "<?xml version=\"1.0\" encoding=\"utf-8\" ?>" +
            "<D:lockinfo xmlns:D=\"DAV:\"><D:lockscope><D:exclusive/></D:lockscope>" +
            "<D:locktype><D:write/></D:locktype><D:owner><D:href>alice</D:href></D:owner></D:lockinfo>";

    private static HttpClient client;

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path root;
    private RecordingDelegate delegate;
    private WebdavServer server;

    @BeforeClass
    public static void init() throws Exception {
        client = new HttpClient();
        client.setFollowRedirects(false);
        client.start();
    }

    @AfterClass
    public static void shutdown() throws Exception {
        client.stop();
    }

    @Before
    public void startServer() throws Exception {
        root = tmp.newFolder("share").toPath().toRealPath();
        delegate = new RecordingDelegate();
        server = start(new WebdavConfig(root));
    }

    @After
    public void stopServer() throws Exception {
        server.stop();
    }

    private WebdavServer start(WebdavConfig config) throws Exception {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("webdav.port", "0");
        params.put("webdav.host", "127.0.0.1");
        return WebdavServer.start(new Args(Collections.emptyList(), params, Collections.emptyMap()), config, delegate);
    }

    private void restart(WebdavConfig config) throws Exception {
        server.stop();
        server = start(config);
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getPort() + path;
    }

    private ContentResponse send(String method, String path, String body, String... headers) throws Exception {
        Request request = client.newRequest(url(path))
                .method(method)
                .timeout(10, TimeUnit.SECONDS)
                .headers(h -> {
                    for (int i = 0; i < headers.length; i += 2)
                        h.put(headers[i], headers[i + 1]);
                });
        if (body != null)
            request.body(new StringRequestContent("application/octet-stream", body, StandardCharsets.UTF_8));
        ContentResponse response = request.send();
        LOG.fine(method + " " + path + " -> " + response.getStatus());
        return response;
    }

    private ContentResponse propfind(String path, String depth) throws Exception {
        return send("PROPFIND", path, null, "Depth", depth);
    }

    private String read(String path) throws Exception {
        return new String(Files.readAllBytes(root.resolve(path.substring(1))), StandardCharsets.UTF_8);
    }

    private void write(String path, String content) throws Exception {
        Path file = root.resolve(path.substring(1));
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    private static int responses(String xml) {
        int count = 0;
        for (int i = xml.indexOf("<D:response>"); i >= 0; i = xml.indexOf("<D:response>", i + 1))
            count++;
        return count;
    }

    @Test
    public void uploadListMoveDownload() throws Exception {
        assertEquals(201, send("PUT", "/a.txt", "hello").getStatus());

        ContentResponse props = send("PROPFIND", "/a.txt",
                "<D:propfind xmlns:D=\"DAV:\"><D:prop><D:getcontentlength/></D:prop></D:propfind>", "Depth", "0");
        assertEquals(207, props.getStatus());
        assertTrue(props.getMediaType().contains("xml"));
        assertTrue(props.getContentAsString(), props.getContentAsString().contains("<D:getcontentlength>5</D:getcontentlength>"));

        assertEquals(201, send("MKCOL", "/sub", null).getStatus());
        assertEquals(201, send("MOVE", "/a.txt", null, "Destination", url("/sub/a.txt")).getStatus());
        assertEquals(404, send("GET", "/a.txt", null).getStatus());

        ContentResponse get = send("GET", "/sub/a.txt", null);
        assertEquals(200, get.getStatus());
        assertEquals("hello", get.getContentAsString());
        assertEquals("text/plain", get.getMediaType());
        assertNotNull(get.getHeaders().get("Last-Modified"));
        assertNotNull(get.getHeaders().get("ETag"));
    }

    @Test
    public void putReplaceAnswersNoContent() throws Exception {
        assertEquals(201, send("PUT", "/a.txt", "one").getStatus());
        assertEquals(204, send("PUT", "/a.txt", "two").getStatus());
        assertEquals("two", read("/a.txt"));
        assertEquals("no upload leftovers", Collections.singletonList("a.txt"), list(root));
    }

    @Test
    public void putErrors() throws Exception {
        assertEquals("missing parent", 409, send("PUT", "/no/such/dir/a.txt", "x").getStatus());
        Files.createDirectory(root.resolve("dir"));
        assertEquals("onto a collection", 405, send("PUT", "/dir", "x").getStatus());
        assertEquals("partial update", 400, send("PUT", "/part.txt", "x", "Content-Range", "bytes 0-0/10").getStatus());
        assertFalse(Files.exists(root.resolve("part.txt")));
    }

    @Test
    public void headMatchesGet() throws Exception {
        write("/a.txt", "hello");
        ContentResponse head = send("HEAD", "/a.txt", null);
        assertEquals(200, head.getStatus());
        assertEquals("5", head.getHeaders().get("Content-Length"));
        assertEquals(0, head.getContent().length);

        String etag = head.getHeaders().get("ETag");
        assertEquals(304, send("GET", "/a.txt", null, "If-None-Match", etag).getStatus());
    }

    @Test
    public void getOfCollectionListsChildren() throws Exception {
        write("/docs/readme.txt", "x");
        write("/docs/.secret", "x");
        ContentResponse listing = send("GET", "/docs", null);
        assertEquals(200, listing.getStatus());
        assertTrue(listing.getContentAsString().contains("readme.txt"));
        assertFalse(listing.getContentAsString().contains(".secret"));
    }

    @Test
    public void options() throws Exception {
        ContentResponse plain = send("OPTIONS", "/", null, "User-Agent", "curl/8.4.0");
        assertEquals(200, plain.getStatus());
        assertEquals("1", plain.getHeaders().get("DAV"));
        String allow = plain.getHeaders().get("Allow");
        for (String method : Arrays.asList("PROPFIND", "MKCOL", "COPY", "MOVE", "LOCK", "UNLOCK"))
            assertTrue(allow, allow.contains(method));

        ContentResponse finder = send("OPTIONS", "/", null, "User-Agent", "WebDAVFS/3.0.0 (03008000) Darwin/21.6.0");
        assertEquals("1, 2", finder.getHeaders().get("DAV"));
    }

    @Test
    public void propfindDepths() throws Exception {
        write("/a.txt", "a");
        write("/b.txt", "b");
        write("/sub/c.txt", "c");

        ContentResponse zero = propfind("/", "0");
        assertEquals(207, zero.getStatus());
        assertEquals(1, responses(zero.getContentAsString()));

        ContentResponse one = propfind("/", "1");
        assertEquals(207, one.getStatus());
        assertEquals("root and its three children", 4, responses(one.getContentAsString()));
        assertFalse(one.getContentAsString().contains("c.txt"));

        assertEquals(403, propfind("/", "infinity").getStatus());
        assertEquals("absent Depth means infinity", 403, send("PROPFIND", "/", null).getStatus());
        assertEquals(400, propfind("/", "2").getStatus());
        assertEquals(404, propfind("/missing.txt", "0").getStatus());
    }

    @Test
    public void malformedPropfind() throws Exception {
        assertEquals(400, send("PROPFIND", "/", "<D:propfind xmlns:D=\"DAV:\"><D:prop>", "Depth", "0").getStatus());
    }

    @Test
    public void windowsProbesIgnored() throws Exception {
        write("/desktop.ini", "[.ShellClassInfo]");
        assertEquals(404, send("PROPFIND", "/desktop.ini", null, "Depth", "0",
                "User-Agent", "Microsoft-WebDAV-MiniRedir/10.0.19045").getStatus());
        assertEquals(207, propfind("/desktop.ini", "0").getStatus());
    }

    @Test
    public void disallowedExtensions() throws Exception {
        restart(new WebdavConfig(root).withAllowedFileExtensions(Arrays.asList("txt")));
        assertEquals(403, send("PUT", "/x.exe", "MZ").getStatus());
        assertFalse(Files.exists(root.resolve("x.exe")));
        assertEquals(201, send("PUT", "/x.txt", "ok").getStatus());
        assertEquals("collections carry no extension", 201, send("MKCOL", "/folder", null).getStatus());

        write("/old.doc", "legacy");
        assertEquals(403, send("GET", "/old.doc", null).getStatus());
        assertEquals(403, send("DELETE", "/old.doc", null).getStatus());
        assertEquals(403, send("COPY", "/x.txt", null, "Destination", url("/x.exe")).getStatus());
        assertFalse(propfind("/", "1").getContentAsString().contains("old.doc"));
    }

    @Test
    public void hiddenItemsRejected() throws Exception {
        assertEquals(403, send("PUT", "/.secret", "x").getStatus());
        assertFalse(Files.exists(root.resolve(".secret")));
        assertEquals(403, send("MKCOL", "/.git", null).getStatus());
        write("/.config/settings.txt", "x");
        assertEquals(403, propfind("/.config", "0").getStatus());
        assertEquals(403, send("GET", "/.config/settings.txt", null).getStatus());

        restart(new WebdavConfig(root).withAllowHiddenItems(true));
        assertEquals(201, send("PUT", "/.secret", "x").getStatus());

        Files.createTempFile(root, ".davshelf-upload-", ".tmp");
        String listing = propfind("/", "1").getContentAsString();
        assertTrue(listing, listing.contains(".secret"));
        assertFalse("upload in progress listed", listing.contains(".davshelf-upload-"));
        assertFalse(send("GET", "/", null).getContentAsString().contains(".davshelf-upload-"));
    }

    @Test
    public void overwriteFalseKeepsDestination() throws Exception {
        write("/a.txt", "A");
        write("/b.txt", "B");
        assertEquals(412, send("COPY", "/a.txt", null, "Destination", url("/b.txt"), "Overwrite", "F").getStatus());
        assertEquals(412, send("MOVE", "/a.txt", null, "Destination", url("/b.txt"), "Overwrite", "F").getStatus());
        assertEquals("B", read("/b.txt"));
        assertEquals("A", read("/a.txt"));
    }

    @Test
    public void overwriteReplacesDestination() throws Exception {
        write("/a.txt", "A");
        write("/b.txt", "B");
        assertEquals(204, send("COPY", "/a.txt", null, "Destination", url("/b.txt"), "Overwrite", "T").getStatus());
        assertEquals("A", read("/b.txt"));

        write("/c.txt", "C");
        assertEquals(204, send("MOVE", "/c.txt", null, "Destination", url("/b.txt")).getStatus());
        assertEquals("C", read("/b.txt"));
        assertFalse(Files.exists(root.resolve("c.txt")));
    }

    @Test
    public void moveRoundTrip() throws Exception {
        write("/dir/one.txt", "1");
        write("/dir/nested/two.txt", "2");
        assertEquals(201, send("MOVE", "/dir", null, "Destination", url("/renamed")).getStatus());
        assertFalse(Files.exists(root.resolve("dir")));
        assertEquals(201, send("MOVE", "/renamed", null, "Destination", url("/dir")).getStatus());
        assertEquals("1", read("/dir/one.txt"));
        assertEquals("2", read("/dir/nested/two.txt"));
        assertEquals(Collections.singletonList("dir"), list(root));
    }

    @Test
    public void copyCollection() throws Exception {
        write("/dir/one.txt", "1");
        write("/dir/nested/two.txt", "2");
        assertEquals(201, send("COPY", "/dir", null, "Destination", url("/copy%20of%20dir")).getStatus());
        assertEquals("2", read("/copy of dir/nested/two.txt"));
        assertEquals("1", read("/dir/one.txt"));

        assertEquals(201, send("COPY", "/dir", null, "Destination", url("/shallow"), "Depth", "0").getStatus());
        assertEquals(Collections.emptyList(), list(root.resolve("shallow")));
    }

    @Test
    public void copyMoveErrors() throws Exception {
        write("/dir/one.txt", "1");
        assertEquals("missing Destination", 400, send("MOVE", "/dir", null).getStatus());
        assertEquals("into itself", 403, send("MOVE", "/dir", null, "Destination", url("/dir/inner")).getStatus());
        assertEquals("onto itself", 403, send("COPY", "/dir", null, "Destination", url("/dir")).getStatus());
        assertEquals("missing source", 404, send("COPY", "/nope.txt", null, "Destination", url("/x.txt")).getStatus());
        assertEquals("missing parent", 409, send("COPY", "/dir/one.txt", null, "Destination", url("/a/b/c.txt")).getStatus());
        assertEquals("outside the share", 403, send("COPY", "/dir/one.txt", null, "Destination", url("/../../etc/x.txt")).getStatus());
        assertEquals("root", 403, send("MOVE", "/", null, "Destination", url("/elsewhere")).getStatus());
        assertEquals("1", read("/dir/one.txt"));
    }

    @Test
    public void replacingAnAncestorIsRefused() throws Exception {
        write("/dir/sub/keep.txt", "keep");
        write("/dir/other.txt", "other");
        for (String method : Arrays.asList("COPY", "MOVE")) {
            assertEquals(method + " onto an ancestor", 403,
                    send(method, "/dir/sub", null, "Destination", url("/dir"), "Overwrite", "T").getStatus());
            assertEquals(method + " left the source", "keep", read("/dir/sub/keep.txt"));
            assertEquals(method + " left the destination", "other", read("/dir/other.txt"));
        }
        assertEquals(Arrays.asList("other.txt", "sub"), list(root.resolve("dir")));
        server.getServlet().flushNotifications();
        assertEquals(Collections.emptyList(), delegate.events);
    }

    @Test
    public void mkcolAndDelete() throws Exception {
        assertEquals(201, send("MKCOL", "/new", null).getStatus());
        assertTrue(Files.isDirectory(root.resolve("new")));
        assertEquals("already exists", 405, send("MKCOL", "/new", null).getStatus());
        assertEquals("missing parent", 409, send("MKCOL", "/x/y", null).getStatus());
        assertEquals("body", 415, send("MKCOL", "/withbody", "<x/>").getStatus());

        write("/new/inner/file.txt", "x");
        assertEquals(204, send("DELETE", "/new", null).getStatus());
        assertFalse(Files.exists(root.resolve("new")));
        assertEquals(404, send("DELETE", "/new", null).getStatus());
        assertEquals(403, send("DELETE", "/", null).getStatus());
        assertEquals(400, send("DELETE", "/x", null, "Depth", "0").getStatus());
    }

    @Test
    public void lockAndUnlock() throws Exception {
        write("/a.txt", "A");
        ContentResponse lock = send("LOCK", "/a.txt", LOCK_BODY, "Timeout", "Second-600", "Depth", "0");
        assertEquals(200, lock.getStatus());
        String header = lock.getHeaders().get("Lock-Token");
        Matcher token = Pattern.compile("<opaquelocktoken:([^>]+)>").matcher(header);
        assertTrue(header, token.matches());
        String body = lock.getContentAsString();
        assertTrue(body, body.contains("<D:href>opaquelocktoken:" + token.group(1) + "</D:href>"));
        assertTrue(body, body.contains("<D:timeout>Second-600</D:timeout>"));
        assertTrue(body, body.contains("<D:href>alice</D:href>"));

        ContentResponse relock = send("LOCK", "/a.txt", null, "If", "(<opaquelocktoken:" + token.group(1) + ">)");
        assertEquals(200, relock.getStatus());
        assertEquals("refresh keeps the token", header, relock.getHeaders().get("Lock-Token"));

        ContentResponse discovery = send("PROPFIND", "/a.txt",
                "<D:propfind xmlns:D=\"DAV:\"><D:prop><D:lockdiscovery/></D:prop></D:propfind>", "Depth", "0");
        assertTrue(discovery.getContentAsString().contains(token.group(1)));

        assertEquals("locks are advisory", 204, send("PUT", "/a.txt", "B").getStatus());

        assertEquals(412, send("UNLOCK", "/a.txt", null, "Lock-Token", "<opaquelocktoken:other>").getStatus());
        assertEquals(400, send("UNLOCK", "/a.txt", null).getStatus());
        assertEquals(204, send("UNLOCK", "/a.txt", null, "Lock-Token", header).getStatus());
        assertEquals(409, send("UNLOCK", "/a.txt", null, "Lock-Token", header).getStatus());
    }

    @Test
    public void lockOfMissingItemCreatesNothing() throws Exception {
        assertEquals(200, send("LOCK", "/draft.txt", LOCK_BODY, "Depth", "0").getStatus());
        assertFalse(Files.exists(root.resolve("draft.txt")));
        assertEquals(400, send("LOCK", "/draft.txt", LOCK_BODY, "Depth", "1").getStatus());
        assertEquals(400, send("LOCK", "/draft.txt", "<D:propfind xmlns:D=\"DAV:\"/>", "Depth", "0").getStatus());
    }

    @Test
    public void unknownMethodLeftToServletContainer() throws Exception {
        assertEquals(501, send("PROPPATCH", "/", null).getStatus());
    }

    @Test
    public void notificationsFollowMutations() throws Exception {
        assertEquals(201, send("PUT", "/a.txt", "hello").getStatus());
        assertEquals(200, send("GET", "/a.txt", null).getStatus());
        assertEquals(201, send("MKCOL", "/dir", null).getStatus());
        assertEquals(201, send("COPY", "/a.txt", null, "Destination", url("/dir/b.txt")).getStatus());
        assertEquals(201, send("MOVE", "/dir/b.txt", null, "Destination", url("/c.txt")).getStatus());
        assertEquals(204, send("DELETE", "/c.txt", null).getStatus());

        server.getServlet().flushNotifications();
        assertEquals(Arrays.asList(
                "upload " + root.resolve("a.txt"),
                "download " + root.resolve("a.txt"),
                "mkdir " + root.resolve("dir"),
                "copy " + root.resolve("a.txt") + " " + root.resolve("dir/b.txt"),
                "move " + root.resolve("dir/b.txt") + " " + root.resolve("c.txt"),
                "delete " + root.resolve("c.txt")), delegate.events);
    }

    @Test
    public void delegateCanRefuse() throws Exception {
        write("/keep.txt", "keep");
        delegate.refuse = true;
        assertEquals(403, send("PUT", "/new.txt", "x").getStatus());
        assertEquals(403, send("DELETE", "/keep.txt", null).getStatus());
        assertEquals(403, send("MKCOL", "/dir", null).getStatus());
        assertEquals(403, send("COPY", "/keep.txt", null, "Destination", url("/copy.txt")).getStatus());
        assertEquals(403, send("MOVE", "/keep.txt", null, "Destination", url("/moved.txt")).getStatus());

        assertEquals("nothing changed and no upload leftovers", Collections.singletonList("keep.txt"), list(root));
        server.getServlet().flushNotifications();
        assertEquals(Collections.emptyList(), delegate.events);
        assertEquals("upload inspected before refusal", 1, delegate.inspectedUploads.size());
    }

    @Test
    public void usernameWithoutPasswordRefusesToStart() throws Exception {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("webdav.port", "0");
        params.put("webdav.username", "alice");
        try {
            WebdavServer.start(new Args(Collections.emptyList(), params, Collections.emptyMap()), new WebdavConfig(root), delegate);
            fail("started an open share for a configured user");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("WEBDAV_PASSWORD"));
        }
    }

    @Test
    public void basicAuthProtectsShare() throws Exception {
        server.stop();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("webdav.port", "0");
        params.put("webdav.host", "127.0.0.1");
        params.put("webdav.username", "alice");
        params.put("WEBDAV_PASSWORD", "s3cret");
        params.put("webdav.authorization.scheme", "basic");
        server = WebdavServer.start(new Args(Collections.emptyList(), params, Collections.emptyMap()), new WebdavConfig(root), delegate);

        assertEquals(401, send("PUT", "/a.txt", "x").getStatus());
        assertFalse(Files.exists(root.resolve("a.txt")));
        String credentials = Base64.getEncoder().encodeToString("alice:s3cret".getBytes(StandardCharsets.UTF_8));
        assertEquals(201, send("PUT", "/a.txt", "x", "Authorization", "Basic " + credentials).getStatus());
    }

    private static List<String> list(Path dir) throws Exception {
        List<String> names = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            children.forEach(p -> names.add(p.getFileName().toString()));
        }
        Collections.sort(names);
        return names;
    }

    private static class RecordingDelegate implements WebdavDelegate {
        final List<String> events = new CopyOnWriteArrayList<>();
        final List<String> inspectedUploads = new CopyOnWriteArrayList<>();
        volatile boolean refuse;

        @Override
        public boolean shouldUploadFileAtPath(Path path, Path temporaryFile) {
            try {
                inspectedUploads.add(new String(Files.readAllBytes(temporaryFile), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
            return ! refuse;
        }

        @Override
        public boolean shouldMoveItemFromPath(Path fromPath, Path toPath) {
            return ! refuse;
        }

        @Override
        public boolean shouldCopyItemFromPath(Path fromPath, Path toPath) {
            return ! refuse;
        }

        @Override
        public boolean shouldDeleteItemAtPath(Path path) {
            return ! refuse;
        }

        @Override
        public boolean shouldCreateDirectoryAtPath(Path path) {
            return ! refuse;
        }

        @Override
        public void didDownloadFileAtPath(Path path) {
            events.add("download " + path);
        }

        @Override
        public void didUploadFileAtPath(Path path) {
            events.add("upload " + path);
        }

        @Override
        public void didMoveItemFromPath(Path fromPath, Path toPath) {
            events.add("move " + fromPath + " " + toPath);
        }

        @Override
        public void didCopyItemFromPath(Path fromPath, Path toPath) {
            events.add("copy " + fromPath + " " + toPath);
        }

        @Override
        public void didDeleteItemAtPath(Path path) {
            events.add("delete " + path);
        }

        @Override
        public void didCreateDirectoryAtPath(Path path) {
            events.add("mkdir " + path);
        }
    }
}
