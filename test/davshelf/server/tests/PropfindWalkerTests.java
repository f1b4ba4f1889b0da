package davshelf.server.tests;

import davshelf.server.webdav.SecurityGate;
import davshelf.server.webdav.WebdavConfig;
import davshelf.server.webdav.exceptions.ObjectNotFoundException;
import davshelf.server.webdav.exceptions.PathRejectedException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.locking.LockManager;
import davshelf.server.webdav.propfind.Depth;
import davshelf.server.webdav.propfind.PropertyResponseBuilder;
import davshelf.server.webdav.propfind.PropertySet;
import davshelf.server.webdav.propfind.PropfindWalker;
import davshelf.server.webdav.store.LocalFileSystemStore;
import org.junit.*;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

public class PropfindWalkerTests {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path root;
    private WebdavConfig config;

    @Before
    public void setup() throws Exception {
        root = tmp.newFolder("share").toPath();
        Files.write(root.resolve("a.txt"), "hello".getBytes());
        Files.write(root.resolve("b.md"), "# b".getBytes());
        Files.write(root.resolve(".hidden"), "secret".getBytes());
        Files.createDirectories(root.resolve("sub"));
        Files.write(root.resolve("sub/c.txt"), "deeper".getBytes());
        config = new WebdavConfig(root);
    }

    private String walk(WebdavConfig config, String path, Depth depth) throws WebdavException {
        SecurityGate gate = new SecurityGate(config);
        PropfindWalker walker = new PropfindWalker(new LocalFileSystemStore(), gate,
                new PropertyResponseBuilder("", new LockManager()));
        return walker.walk(gate.authorize(path), depth, PropertySet.all());
    }

    private static int responses(String xml) {
        int count = 0;
        for (int i = xml.indexOf("<D:response>"); i >= 0; i = xml.indexOf("<D:response>", i + 1))
            count++;
        return count;
    }

    @Test
    public void depthZeroDescribesTargetOnly() throws Exception {
        String xml = walk(config, "/", Depth.ZERO);
        Assert.assertTrue(xml.startsWith("<?xml"));
        Assert.assertTrue(xml.contains("<D:multistatus xmlns:D=\"DAV:\">"));
        Assert.assertEquals(1, responses(xml));
        Assert.assertEquals(1, responses(walk(config, "/a.txt", Depth.ZERO)));
    }

    @Test
    public void depthOneListsVisibleChildren() throws Exception {
        String xml = walk(config, "/", Depth.ONE);
        Assert.assertEquals("root, a.txt, b.md and sub", 4, responses(xml));
        Assert.assertTrue(xml.contains("<D:href>/sub/</D:href>"));
        Assert.assertFalse("hidden item listed", xml.contains(".hidden"));
        Assert.assertFalse("grandchild listed", xml.contains("c.txt"));
    }

    @Test
    public void depthOneOfFileIsJustTheFile() throws Exception {
        Assert.assertEquals(1, responses(walk(config, "/a.txt", Depth.ONE)));
    }

    @Test
    public void hiddenItemsListedWhenAllowed() throws Exception {
        String xml = walk(config.withAllowHiddenItems(true), "/", Depth.ONE);
        Assert.assertEquals(5, responses(xml));
        Assert.assertTrue(xml.contains("<D:href>/.hidden</D:href>"));
    }

    @Test
    public void disallowedExtensionsFiltered() throws Exception {
        WebdavConfig restricted = config.withAllowedFileExtensions(Arrays.asList("txt"));
        String xml = walk(restricted, "/", Depth.ONE);
        Assert.assertEquals("root, a.txt and sub", 3, responses(xml));
        Assert.assertFalse(xml.contains("b.md"));
        try {
            walk(restricted, "/b.md", Depth.ZERO);
            Assert.fail("disallowed file described");
        } catch (PathRejectedException e) {
            Assert.assertEquals(403, e.getStatus());
        }
    }

    @Test
    public void symlinkLeavingShareNotListed() throws Exception {
        Path outside = tmp.newFolder("outside").toPath();
        Files.createSymbolicLink(root.resolve("escape"), outside);
        String xml = walk(config, "/", Depth.ONE);
        Assert.assertFalse(xml.contains("escape"));
    }

    @Test
    public void infiniteDepthForbidden() throws Exception {
        try {
            walk(config, "/", Depth.INFINITY);
            Assert.fail("infinite depth walked");
        } catch (WebdavException e) {
            Assert.assertEquals(403, e.getStatus());
        }
    }

    @Test(expected = ObjectNotFoundException.class)
    public void missingTarget() throws Exception {
        walk(config, "/nope.txt", Depth.ZERO);
    }
}
