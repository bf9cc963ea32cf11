package cn.edu.pku.asic.h3columnar.dggs.h3;

import com.uber.h3core.H3Core;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * =============================================================================================
 *
 * @ProjectName dggs
 * @Package cn.edu.pku.asic.h3columnar.dggs.h3
 * @ClassName H3
 * @Version 1.0.0
 * @See =============================================================================================
 * @Description Holds the single instance of the H3 library. The library extracts and loads a native
 *              library on first use, so it is created lazily and shared by all kernels. H3Core is
 *              stateless and safe to call from several threads.
 */
public final class H3 {
    private static final Log LOG = LogFactory.getLog(H3.class);

    private static volatile H3 h3Instance;

    private final H3Core core;

    private H3(H3Core core) {
        this.core = core;
    }

    public static H3 getInstance() {
        if (h3Instance == null) {
            synchronized (H3.class) {
                if (h3Instance == null) {
                    try {
                        h3Instance = new H3(H3Core.newInstance());
                        LOG.debug("Loaded the H3 native library");
                    } catch (IOException e) {
                        throw new UncheckedIOException("Cannot load the H3 native library", e);
                    }
                }
            }
        }
        return h3Instance;
    }

    public H3Core getCore() {
        return core;
    }
}
