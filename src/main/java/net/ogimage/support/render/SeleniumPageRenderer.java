package net.ogimage.support.render;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.ogimage.application.render.PageRenderer;
import net.ogimage.domain.render.RenderTarget;
import net.ogimage.exception.RenderFailedException;
import net.ogimage.exception.RenderTimeoutException;
import org.openqa.selenium.By;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

/**
 * Headless Chrome renderer.
 *
 * <p>A browser session is created for every render and always quit afterwards. After the
 * document reports {@code complete}, common cookie and consent overlays are hidden on a
 * best-effort basis before the viewport is captured.</p>
 */
@Slf4j
public class SeleniumPageRenderer implements PageRenderer {

    static final List<String> CONSENT_BANNER_SELECTORS = List.of(
        ".cookie-consent-banner",
        "#cookie-notice",
        ".cookie-banner",
        ".consent-banner",
        "#onetrust-consent-sdk",
        "#CybotCookiebotDialog",
        "[id*='consent']",
        "[class*='consent']",
        "[aria-label*='consent']",
        "[aria-label*='cookie']"
    );

    static final String HIDE_ELEMENTS_SCRIPT = """
        const selectors = arguments[0];
        let hiddenCount = 0;
        selectors.forEach(selector => {
            try {
                document.querySelectorAll(selector).forEach(el => {
                    if (el.style.display !== 'none') {
                        el.style.display = 'none';
                        hiddenCount++;
                    }
                });
            } catch (e) {
                // invalid selector in this document
            }
        });
        return hiddenCount;
        """;

    private static final Duration SCRIPT_TIMEOUT = Duration.ofSeconds(5);

    private final Supplier<WebDriver> driverFactory;

    public SeleniumPageRenderer() {
        this(SeleniumPageRenderer::createHeadlessChrome);
    }

    SeleniumPageRenderer(Supplier<WebDriver> driverFactory) {
        this.driverFactory = driverFactory;
    }

    @Override
    public byte[] render(RenderTarget target, Duration pageLoadTimeout) {
        log.info("Rendering {} at {}x{}", target.url(), target.width(), target.height());
        WebDriver driver = null;
        try {
            driver = driverFactory.get();
            driver.manage().timeouts().pageLoadTimeout(pageLoadTimeout);
            driver.manage().timeouts().scriptTimeout(SCRIPT_TIMEOUT);
            driver.manage().window().setSize(new Dimension(target.width(), target.height()));

            driver.get(target.url());
            WebDriverWait wait = new WebDriverWait(driver, pageLoadTimeout);
            wait.until(ExpectedConditions.visibilityOfElementLocated(By.tagName("body")));
            wait.until(d -> "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));

            hideConsentBanners(driver, target.url());
            byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
            if (png == null || png.length == 0) {
                throw new RenderFailedException("Browser returned an empty screenshot for " + target.url());
            }
            return png;
        } catch (TimeoutException ex) {
            throw new RenderTimeoutException(target.url(), pageLoadTimeout, ex);
        } catch (WebDriverException ex) {
            throw new RenderFailedException(firstLine(ex.getMessage()), ex);
        } finally {
            quitQuietly(driver);
        }
    }

    private void hideConsentBanners(WebDriver driver, String url) {
        try {
            Object hidden = ((JavascriptExecutor) driver).executeScript(HIDE_ELEMENTS_SCRIPT, CONSENT_BANNER_SELECTORS);
            log.debug("Banner hiding script ran for {}; elements hidden: {}", url, hidden);
        } catch (WebDriverException ex) {
            log.warn("Banner hiding failed for {}: {}. Capturing anyway.", url, firstLine(ex.getMessage()));
        }
    }

    private void quitQuietly(WebDriver driver) {
        if (driver == null) {
            return;
        }
        try {
            driver.quit();
        } catch (WebDriverException ex) {
            log.warn("Failed to quit browser session: {}", firstLine(ex.getMessage()));
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown browser error";
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline).trim() : message.trim();
    }

    private static WebDriver createHeadlessChrome() {
        ChromeOptions options = new ChromeOptions();
        options.addArguments(
            "--headless=new",
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-popup-blocking",
            "--hide-scrollbars",
            "--disable-gpu",
            "--force-device-scale-factor=1"
        );
        return new ChromeDriver(options);
    }
}
