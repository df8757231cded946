package patcher.config;

/**
 * When rewritten files are written back to disk.
 *
 * @see PatchConfig#writeMode()
 */
public enum WriteMode {
    /**
     * Write each changed file as soon as it has been transformed.
     *
     * <p>A failure mid-run leaves earlier files rewritten and later ones untouched.
     */
    INCREMENTAL,

    /**
     * Transform every file in memory first and write back only after the
     * whole file set transformed without error.
     */
    STAGED
}
