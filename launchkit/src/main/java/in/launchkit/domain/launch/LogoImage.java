package in.launchkit.domain.launch;

/**
 * Downloaded campaign logo, ready for multipart upload.
 */
public record LogoImage(byte[] bytes, String filename, String contentType) {

    public int size() {
        return bytes.length;
    }

    @Override
    public String toString() {
        return "LogoImage[" + filename + ", " + contentType + ", " + bytes.length + " bytes]";
    }
}
