package quest.gekko.iptv;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IptvCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(IptvCatalogApplication.class, args);
    }

}
