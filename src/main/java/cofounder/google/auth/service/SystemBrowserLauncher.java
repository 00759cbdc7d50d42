package cofounder.google.auth.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.util.List;
import java.util.Locale;

@Slf4j
@Component
public class SystemBrowserLauncher implements BrowserLauncher {
    private final PrintStream out;

    public SystemBrowserLauncher(@Qualifier("consoleOut") PrintStream out) {
        this.out = out;
    }

    @Override
    public void open(String url) {
        out.println("Opening browser for authorization...");
        out.println();
        out.println("If browser does not open, visit this URL:");
        out.println(url);
        out.println();

        try {
            if (!GraphicsEnvironment.isHeadless() && Desktop.isDesktopSupported()
                    && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
                Desktop.getDesktop().browse(URI.create(url));
                return;
            }
            new ProcessBuilder(openCommand(url)).inheritIO().start();
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("Could not open a browser ({}); use the URL printed above", e.getMessage());
        }
    }

    private static List<String> openCommand(String url) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("mac")) {
            return List.of("open", url);
        }
        if (os.contains("win")) {
            return List.of("rundll32", "url.dll,FileProtocolHandler", url);
        }
        return List.of("xdg-open", url);
    }
}
