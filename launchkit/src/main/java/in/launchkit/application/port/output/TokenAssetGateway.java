package in.launchkit.application.port.output;

import in.launchkit.domain.launch.LogoImage;
import in.launchkit.domain.launch.TokenMetadataForm;

/**
 * Logo download and metadata upload.
 */
public interface TokenAssetGateway {

    /**
     * Download a logo under the configured size and timeout limits.
     *
     * @throws in.launchkit.domain.common.LaunchKitException LOGO_FETCH_FAILED
     */
    LogoImage fetchLogo(String url);

    /**
     * @return the metadata URI assigned by the content store
     */
    String uploadMetadata(TokenMetadataForm form, LogoImage logo);
}
