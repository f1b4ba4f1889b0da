package davshelf.server.tests;

import davshelf.server.webdav.ClientQuirk;
import org.junit.*;

import java.util.HashMap;
import java.util.Map;

public class ClientQuirkTests {

    private static ClientQuirk detect(String userAgent) {
        Map<String, String> headers = new HashMap<>();
        if (userAgent != null)
            headers.put("User-Agent", userAgent);
        return ClientQuirk.detect(headers::get);
    }

    @Test
    public void finderGetsClassTwo() {
        Assert.assertEquals(ClientQuirk.MAC_FINDER, detect("WebDAVFS/3.0.0 (03008000) Darwin/21.6.0 (x86_64)"));
        Assert.assertEquals(ClientQuirk.MAC_FINDER, detect("WebDAVLib/1.3"));
        Assert.assertEquals("1, 2", detect("WebDAVFS/3.0.0").davCompliance());
    }

    @Test
    public void everyoneElseGetsClassOne() {
        Assert.assertEquals(ClientQuirk.NONE, detect("curl/8.4.0"));
        Assert.assertEquals(ClientQuirk.NONE, detect(null));
        Assert.assertEquals("1", detect("curl/8.4.0").davCompliance());
        Assert.assertEquals("1", detect("Microsoft-WebDAV-MiniRedir/10.0.19045").davCompliance());
    }

    @Test
    public void windowsProbesAreIgnored() {
        ClientQuirk windows = detect("Microsoft-WebDAV-MiniRedir/10.0.19045");
        Assert.assertEquals(ClientQuirk.WINDOWS_MINIREDIRECTOR, windows);
        Assert.assertTrue(windows.ignoresPropfindOf("desktop.ini"));
        Assert.assertTrue(windows.ignoresPropfindOf("Folder.JPG"));
        Assert.assertFalse(windows.ignoresPropfindOf("notes.txt"));
        Assert.assertFalse(ClientQuirk.NONE.ignoresPropfindOf("desktop.ini"));
    }
}
