package davshelf.server.tests;

import davshelf.server.webdav.locking.LockManager;
import davshelf.server.webdav.locking.LockScope;
import davshelf.server.webdav.locking.LockToken;
import davshelf.server.webdav.propfind.DavProperty;
import davshelf.server.webdav.propfind.PropertyResponseBuilder;
import davshelf.server.webdav.propfind.PropertySet;
import davshelf.server.webdav.store.Resource;
import davshelf.server.webdav.xml.XMLWriter;
import org.junit.*;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

public class PropertyResponseBuilderTests {

    private static final Instant MODIFIED = Instant.parse("2024-01-02T03:04:05Z");
    private static final Instant CREATED = Instant.parse("2023-12-31T23:59:58Z");

    private final LockManager locks = new LockManager();
    private final PropertyResponseBuilder builder = new PropertyResponseBuilder("", locks);

    private static Resource file(String path, long size) {
        return new Resource(path, Resource.Kind.FILE, size, MODIFIED, CREATED, "text/plain");
    }

    private static Resource folder(String path) {
        return new Resource(path, Resource.Kind.COLLECTION, 4096, MODIFIED, null, "httpd/unix-directory");
    }

    private static void assertContains(String xml, String expected) {
        Assert.assertTrue("Expected " + expected + " in\n" + xml, xml.contains(expected));
    }

    @Test
    public void fileProperties() {
        String xml = builder.buildResponse(file("/docs/a&b.txt", 5), PropertySet.all());
        assertContains(xml, "<D:response xmlns:D=\"DAV:\">");
        assertContains(xml, "<D:href>/docs/a%26b.txt</D:href>");
        assertContains(xml, "<D:resourcetype/>");
        assertContains(xml, "<D:creationdate>2023-12-31T23:59:58Z</D:creationdate>");
        assertContains(xml, "<D:getlastmodified>Tue, 02 Jan 2024 03:04:05 GMT</D:getlastmodified>");
        assertContains(xml, "<D:getcontentlength>5</D:getcontentlength>");
        assertContains(xml, "<D:getcontenttype>text/plain</D:getcontenttype>");
        assertContains(xml, "<D:displayname>a&amp;b.txt</D:displayname>");
        assertContains(xml, "<executable xmlns=\"http://apache.org/dav/props/\">F</executable>");
        assertContains(xml, "<D:status>HTTP/1.1 200 OK</D:status>");
        Assert.assertFalse(xml.contains("getetag"));
    }

    @Test
    public void collectionProperties() {
        String xml = builder.buildResponse(folder("/my folder"), PropertySet.all());
        assertContains(xml, "<D:href>/my%20folder/</D:href>");
        assertContains(xml, "<D:resourcetype><D:collection/></D:resourcetype>");
        assertContains(xml, "<D:getcontentlength>0</D:getcontentlength>");
        assertContains(xml, "<D:getcontenttype>httpd/unix-directory</D:getcontenttype>");
        // no recorded creation time falls back to the modification time
        assertContains(xml, "<D:creationdate>2024-01-02T03:04:05Z</D:creationdate>");
    }

    @Test
    public void rootHref() {
        Assert.assertEquals("/", builder.href(folder("/")));
        Assert.assertEquals("/dav/", new PropertyResponseBuilder("/dav/", locks).href(folder("/")));
        Assert.assertEquals("/dav/%C3%A9t%C3%A9.txt", new PropertyResponseBuilder("/dav", locks).href(file("/été.txt", 1)));
    }

    @Test
    public void onlyRequestedProperties() {
        String xml = builder.buildResponse(file("/a.txt", 5), PropertySet.of(DavProperty.CONTENT_LENGTH));
        assertContains(xml, "<D:getcontentlength>5</D:getcontentlength>");
        Assert.assertFalse(xml.contains("displayname"));
        Assert.assertFalse(xml.contains("resourcetype"));
    }

    @Test
    public void unknownPropertiesReportedMissing() throws Exception {
        PropertySet set = PropertySet.parse(("<D:propfind xmlns:D=\"DAV:\" xmlns:X=\"urn:x\">" +
                "<D:prop><D:getcontentlength/><X:color/></D:prop></D:propfind>").getBytes(StandardCharsets.UTF_8));
        String xml = builder.buildResponse(file("/a.txt", 5), set);
        assertContains(xml, "<color xmlns=\"urn:x\"/>");
        assertContains(xml, "<D:status>HTTP/1.1 404 Not Found</D:status>");
        assertContains(xml, "<D:status>HTTP/1.1 200 OK</D:status>");
    }

    @Test
    public void propertyNames() {
        String xml = builder.buildResponse(file("/a.txt", 5), PropertySet.namesOnly());
        assertContains(xml, "<D:getcontentlength/>");
        assertContains(xml, "<D:lockdiscovery/>");
        Assert.assertFalse(xml.contains(">5<"));
    }

    @Test
    public void lockDiscovery() {
        String empty = builder.buildResponse(file("/a.txt", 5), PropertySet.of(DavProperty.LOCK_DISCOVERY));
        assertContains(empty, "<D:lockdiscovery/>");

        LockToken lock = locks.lock("/a.txt", LockScope.EXCLUSIVE, "bob & co", 0, 120, Optional.empty());
        String xml = builder.buildResponse(file("/a.txt", 5), PropertySet.of(DavProperty.LOCK_DISCOVERY, DavProperty.SUPPORTED_LOCK));
        assertContains(xml, "<D:href>" + lock.getUri() + "</D:href>");
        assertContains(xml, "<D:timeout>Second-120</D:timeout>");
        assertContains(xml, "<D:href>bob &amp; co</D:href>");
        assertContains(xml, "<D:shared/>");
    }

    @Test
    public void escaping() {
        Assert.assertEquals("&lt;a href=&quot;x&quot;&gt; &amp; &apos;", XMLWriter.escape("<a href=\"x\"> & '"));
    }
}
