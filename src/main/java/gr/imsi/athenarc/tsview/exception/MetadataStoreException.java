package gr.imsi.athenarc.tsview.exception;

public class MetadataStoreException extends TsApiException {

    public MetadataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
