/*
 * Copyright 1999,2004 The Apache Software Foundation.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package davshelf.server.webdav.xml;

import java.nio.charset.StandardCharsets;
import java.util.BitSet;

/**
 * Percent encoding of paths for href elements. Unlike java.net.URLEncoder the set of characters left alone is
 * configurable, so '/' survives and spaces become %20.
 *
 * @author Craig R. McClanahan
 * @author Remy Maucherat
 */
public class URLEncoder {

    protected static final char[] HEXADECIMAL = {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'A', 'B', 'C', 'D', 'E', 'F'};

    // Array containing the safe characters set.
    protected final BitSet safeCharacters = new BitSet(128);

    public URLEncoder() {
        for (char i = 'a'; i <= 'z'; i++) {
            addSafeCharacter(i);
        }
        for (char i = 'A'; i <= 'Z'; i++) {
            addSafeCharacter(i);
        }
        for (char i = '0'; i <= '9'; i++) {
            addSafeCharacter(i);
        }
        for (char c : "$-_.!*'(),~".toCharArray()) {
            addSafeCharacter(c);
        }
    }

    /**
     * The encoder used for hrefs: path separators are kept.
     */
    public static URLEncoder forPaths() {
        URLEncoder encoder = new URLEncoder();
        encoder.addSafeCharacter('/');
        return encoder;
    }

    public void addSafeCharacter( char c ) {
        safeCharacters.set(c);
    }

    public String encode( String path ) {
        StringBuilder rewrittenPath = new StringBuilder(path.length());
        int i = 0;
        while (i < path.length()) {
            int codePoint = path.codePointAt(i);
            int width = Character.charCount(codePoint);
            if (codePoint < 128 && safeCharacters.get(codePoint)) {
                rewrittenPath.append((char)codePoint);
            } else {
                for (byte toEncode : path.substring(i, i + width).getBytes(StandardCharsets.UTF_8)) {
                    rewrittenPath.append('%');
                    rewrittenPath.append(HEXADECIMAL[(toEncode & 0xf0) >> 4]);
                    rewrittenPath.append(HEXADECIMAL[toEncode & 0x0f]);
                }
            }
            i += width;
        }
        return rewrittenPath.toString();
    }
}
