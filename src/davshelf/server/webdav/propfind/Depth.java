package davshelf.server.webdav.propfind;

import davshelf.server.webdav.exceptions.BadRequestException;

/**
 * Value of a Depth header.
 */
public enum Depth {
    ZERO("0"),
    ONE("1"),
    INFINITY("infinity");

    private final String headerValue;

    Depth(String headerValue) {
        this.headerValue = headerValue;
    }

    public String headerValue() {
        return headerValue;
    }

    /**
     * @param header the raw header, null when absent; absence means infinity
     * @throws BadRequestException for anything but 0, 1 or infinity
     */
    public static Depth parse(String header) throws BadRequestException {
        if (header == null)
            return INFINITY;
        String value = header.trim();
        for (Depth depth : values()) {
            if (depth.headerValue.equalsIgnoreCase(value))
                return depth;
        }
        throw new BadRequestException("Invalid Depth header: " + header);
    }
}
