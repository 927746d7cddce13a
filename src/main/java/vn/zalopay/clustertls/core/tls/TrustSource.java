package vn.zalopay.clustertls.core.tls;

/** Which input supplied the trust anchors of a context. */
public enum TrustSource {
    INLINE,
    FILE,
    /** No CA configured; the process default trust store is used. */
    DEFAULT
}
